package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RankingConfig(
    @JsonAlias({"result_limit"}) int resultLimit,
    @JsonAlias({"similarity_floor"}) double similarityFloor,
    @JsonAlias({"time_weight"}) double timeWeight
) {

    public static RankingConfig defaults() {
        return new RankingConfig(10, 0.5, 0.3);
    }
}

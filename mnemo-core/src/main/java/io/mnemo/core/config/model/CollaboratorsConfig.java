package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CollaboratorsConfig(
    EmbeddingConfig embedding,
    SummarizerConfig summarizer,
    @JsonAlias({"recommend_timeout_ms"}) long recommendTimeoutMs
) {

    public static CollaboratorsConfig defaults() {
        return new CollaboratorsConfig(EmbeddingConfig.defaults(), SummarizerConfig.defaults(), 30_000);
    }
}

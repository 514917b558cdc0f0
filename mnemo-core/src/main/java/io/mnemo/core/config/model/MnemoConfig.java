package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MnemoConfig(
    StorageConfig storage,
    RankingConfig ranking,
    EvolutionConfig evolution,
    InsightConfig insights,
    SafetyConfig safety,
    CollaboratorsConfig collaborators,
    GatewayConfig gateway
) {

    public static MnemoConfig defaults() {
        return new MnemoConfig(
            StorageConfig.defaults(),
            RankingConfig.defaults(),
            EvolutionConfig.defaults(),
            InsightConfig.defaults(),
            SafetyConfig.defaults(),
            CollaboratorsConfig.defaults(),
            GatewayConfig.defaults()
        );
    }
}

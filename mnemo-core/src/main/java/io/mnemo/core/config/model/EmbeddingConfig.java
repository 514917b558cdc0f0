package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingConfig(
    String provider,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    int dimensions,
    @JsonAlias({"timeout_ms"}) long timeoutMs,
    @JsonAlias({"max_attempts"}) int maxAttempts
) {

    public static EmbeddingConfig defaults() {
        return new EmbeddingConfig("hashing", "", "https://api.openai.com/v1", "text-embedding-3-small", 256, 10_000, 3);
    }
}

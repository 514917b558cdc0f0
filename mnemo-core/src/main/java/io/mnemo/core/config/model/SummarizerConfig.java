package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SummarizerConfig(
    String provider,
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    String model,
    @JsonAlias({"max_tokens"}) int maxTokens,
    @JsonAlias({"timeout_ms"}) long timeoutMs,
    @JsonAlias({"max_attempts"}) int maxAttempts
) {

    public static SummarizerConfig defaults() {
        return new SummarizerConfig("extractive", "", "https://api.openai.com/v1", "gpt-4o-mini", 512, 30_000, 2);
    }
}

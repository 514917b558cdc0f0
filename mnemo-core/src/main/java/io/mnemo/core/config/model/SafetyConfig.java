package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.collaborator.KeywordInputGuard;
import io.mnemo.core.pipeline.OutputValidator;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SafetyConfig(
    @JsonAlias({"emergency_keywords"}) List<String> emergencyKeywords,
    String disclaimer
) {
    public SafetyConfig {
        emergencyKeywords = emergencyKeywords == null ? List.of() : List.copyOf(emergencyKeywords);
    }

    public static SafetyConfig defaults() {
        return new SafetyConfig(KeywordInputGuard.DEFAULT_KEYWORDS, OutputValidator.DEFAULT_DISCLAIMER);
    }
}

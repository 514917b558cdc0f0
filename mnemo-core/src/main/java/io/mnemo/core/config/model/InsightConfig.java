package io.mnemo.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.mnemo.core.insight.ForgottenInsightDetector;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightConfig(
    List<String> markers,
    @JsonAlias({"max_insights"}) int maxInsights
) {
    public InsightConfig {
        markers = markers == null ? List.of() : List.copyOf(markers);
    }

    public static InsightConfig defaults() {
        return new InsightConfig(ForgottenInsightDetector.DEFAULT_MARKERS, ForgottenInsightDetector.DEFAULT_MAX_INSIGHTS);
    }
}

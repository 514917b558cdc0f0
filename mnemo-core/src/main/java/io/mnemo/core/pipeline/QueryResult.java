package io.mnemo.core.pipeline;

import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.ranking.RankedCandidate;
import java.time.Instant;
import java.util.List;

// Fields a degraded run could not produce stay null and are named in absentFields.
public record QueryResult(
    String ownerId,
    QueryOutcome outcome,
    Instant asOf,
    int recordsSearched,
    List<RankedCandidate> candidates,
    List<ForgottenInsight> insights,
    String summary,
    List<String> recommendations,
    int reinforcedCount,
    String disclaimer,
    List<SafetyFlag> safetyFlags,
    List<String> emergencyIndicators,
    String safetyMessage,
    List<PipelineState> failedStages,
    List<String> absentFields,
    List<PipelineState> trace
) {
    public static final String FIELD_CANDIDATES = "candidates";
    public static final String FIELD_INSIGHTS = "insights";
    public static final String FIELD_SUMMARY = "summary";
    public static final String FIELD_RECOMMENDATIONS = "recommendations";

    public QueryResult {
        candidates = candidates == null ? null : List.copyOf(candidates);
        insights = insights == null ? null : List.copyOf(insights);
        recommendations = recommendations == null ? null : List.copyOf(recommendations);
        safetyFlags = safetyFlags == null ? List.of() : List.copyOf(safetyFlags);
        emergencyIndicators = emergencyIndicators == null ? List.of() : List.copyOf(emergencyIndicators);
        failedStages = failedStages == null ? List.of() : List.copyOf(failedStages);
        absentFields = absentFields == null ? List.of() : List.copyOf(absentFields);
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public boolean degraded() {
        return outcome == QueryOutcome.DEGRADED;
    }

    public boolean flagged() {
        return !safetyFlags.isEmpty();
    }

    public List<RankedCandidate> recent() {
        return candidates == null ? null : candidates.stream().filter(RankedCandidate::recent).toList();
    }

    public List<RankedCandidate> old() {
        return candidates == null ? null : candidates.stream().filter(candidate -> !candidate.recent()).toList();
    }

    public QueryResult withValidatedOutput(
        String validatedSummary,
        List<String> validatedRecommendations,
        String validatedDisclaimer,
        List<SafetyFlag> flags
    ) {
        return new QueryResult(
            ownerId,
            outcome,
            asOf,
            recordsSearched,
            candidates,
            insights,
            validatedSummary,
            validatedRecommendations,
            reinforcedCount,
            validatedDisclaimer,
            flags,
            emergencyIndicators,
            safetyMessage,
            failedStages,
            absentFields,
            trace
        );
    }

    QueryResult withTrace(List<PipelineState> finalTrace) {
        return new QueryResult(
            ownerId,
            outcome,
            asOf,
            recordsSearched,
            candidates,
            insights,
            summary,
            recommendations,
            reinforcedCount,
            disclaimer,
            safetyFlags,
            emergencyIndicators,
            safetyMessage,
            failedStages,
            absentFields,
            finalTrace
        );
    }
}

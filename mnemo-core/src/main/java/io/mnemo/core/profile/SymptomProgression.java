package io.mnemo.core.profile;

import java.time.Instant;
import java.util.List;

public record SymptomProgression(
    String ownerId,
    String symptom,
    int windowDays,
    int occurrences,
    Instant firstOccurrence,
    Instant latestOccurrence,
    double averageGapDays,
    ProgressionTrend trend,
    List<ProgressionEntry> entries
) {
    public SymptomProgression {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static SymptomProgression none(String ownerId, String symptom, int windowDays) {
        return new SymptomProgression(ownerId, symptom, windowDays, 0, null, null, 0.0, ProgressionTrend.NONE, List.of());
    }
}

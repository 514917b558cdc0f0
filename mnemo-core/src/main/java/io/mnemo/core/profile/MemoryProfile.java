package io.mnemo.core.profile;

import java.time.Instant;
import java.util.Map;

public record MemoryProfile(
    String ownerId,
    int totalRecords,
    Map<String, Integer> categoryCounts,
    Instant earliest,
    Instant latest,
    long spanDays,
    MemoryHealth health
) {
    public MemoryProfile {
        categoryCounts = categoryCounts == null ? Map.of() : Map.copyOf(categoryCounts);
    }
}

package io.mnemo.core.profile;

import java.util.List;

public record MemoryHealth(
    HealthStatus status,
    double score,
    double recencyScore,
    double diversityScore,
    double continuityScore,
    List<String> suggestions
) {
    public static final MemoryHealth EMPTY = new MemoryHealth(HealthStatus.EMPTY, 0.0, 0.0, 0.0, 0.0, List.of());

    public MemoryHealth {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}

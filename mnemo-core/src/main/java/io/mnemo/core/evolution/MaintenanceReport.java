package io.mnemo.core.evolution;

import java.time.Instant;

public record MaintenanceReport(
    String ownerId,
    int decayedCount,
    int protectedCount,
    int skippedYoungCount,
    int alreadyMaintainedCount,
    Instant asOf
) {
    public int examinedCount() {
        return decayedCount + skippedYoungCount + alreadyMaintainedCount;
    }
}

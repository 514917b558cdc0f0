package io.mnemo.core.evolution;

import java.time.Duration;

public record DecayPolicy(
    int thresholdDays,
    double scaleDays,
    double minimumFactor,
    int protectionAccessThreshold,
    double protectedFloor,
    Duration minimumMaintenanceInterval,
    double minimumWeight
) {
    public static final double DEFAULT_MINIMUM_WEIGHT = 1e-6;
    public static final DecayPolicy DEFAULT = new DecayPolicy(
        365, 1000.0, 0.3, 5, 0.7, Duration.ofDays(1), DEFAULT_MINIMUM_WEIGHT
    );

    public DecayPolicy {
        if (thresholdDays < 0) {
            throw new IllegalArgumentException("thresholdDays must be >= 0");
        }
        if (!(scaleDays > 0)) {
            throw new IllegalArgumentException("scaleDays must be > 0");
        }
        if (!(minimumFactor > 0) || minimumFactor > 1.0 || !(protectedFloor > 0) || protectedFloor > 1.0) {
            throw new IllegalArgumentException("decay factors must be within (0, 1]");
        }
        if (!(minimumWeight > 0) || Double.isInfinite(minimumWeight)) {
            throw new IllegalArgumentException("minimumWeight must be a positive finite number");
        }
        minimumMaintenanceInterval = minimumMaintenanceInterval == null ? Duration.ZERO : minimumMaintenanceInterval;
    }

    public boolean applies(long ageDays) {
        return ageDays > thresholdDays;
    }

    public boolean protects(int accessCount) {
        return accessCount >= protectionAccessThreshold;
    }

    public double factor(long ageDays, int accessCount) {
        double factor = Math.max(minimumFactor, 1.0 - (ageDays - thresholdDays) / scaleDays);
        if (protects(accessCount)) {
            factor = Math.max(factor, protectedFloor);
        }
        return factor;
    }

    public double decayedWeight(double currentWeight, long ageDays, int accessCount) {
        return Math.max(minimumWeight, currentWeight * factor(ageDays, accessCount));
    }
}

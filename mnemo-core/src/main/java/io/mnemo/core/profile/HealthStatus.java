package io.mnemo.core.profile;

public enum HealthStatus {
    EMPTY,
    NEEDS_IMPROVEMENT,
    FAIR,
    GOOD,
    EXCELLENT;

    static HealthStatus fromScore(double score) {
        if (score > 0.8) {
            return EXCELLENT;
        }
        if (score > 0.6) {
            return GOOD;
        }
        if (score > 0.4) {
            return FAIR;
        }
        return NEEDS_IMPROVEMENT;
    }
}

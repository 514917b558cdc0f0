package io.mnemo.core.pipeline;

public enum QueryOutcome {
    ACCEPTED,
    REJECTED,
    DEGRADED
}

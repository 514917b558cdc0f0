package io.mnemo.core.profile;

public enum ProgressionTrend {
    NONE,
    ISOLATED,
    RECURRING
}

package io.mnemo.core.insight;

public enum InsightKind {
    UNFOLLOWED_RECOMMENDATION,
    HISTORICAL_MATCH,
    RECURRING_SEASON
}

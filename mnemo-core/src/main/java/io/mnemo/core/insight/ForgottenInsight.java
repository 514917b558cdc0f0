package io.mnemo.core.insight;

// action is only set for UNFOLLOWED_RECOMMENDATION
public record ForgottenInsight(InsightKind kind, String recordId, long ageDays, String action, String message) {
    public static ForgottenInsight unfollowed(String recordId, long ageDays, String action) {
        return new ForgottenInsight(
            InsightKind.UNFOLLOWED_RECOMMENDATION,
            recordId,
            ageDays,
            action,
            "Unfollowed recommendation from " + (ageDays / 30) + " months ago: " + action + "."
        );
    }

    public long monthsAgo() {
        return ageDays / 30;
    }
}

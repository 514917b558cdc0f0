package io.mnemo.core.profile;

public record RecurringPattern(String category, int count, int windowDays) {
    public String description() {
        return "Recurring " + category + " records (" + count + " occurrences in " + windowDays + " days)";
    }
}

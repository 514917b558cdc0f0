package io.mnemo.core.record;

import java.time.Instant;
import java.util.Locale;

public record RecordFilter(
    String category,
    String tag,
    Instant createdFrom,
    Instant createdTo
) {
    public static final RecordFilter ALL = new RecordFilter(null, null, null, null);

    public static RecordFilter between(Instant from, Instant to) {
        return new RecordFilter(null, null, from, to);
    }

    public boolean matches(MemoryRecord record) {
        if (category != null && !category.isBlank()
            && !category.trim().toLowerCase(Locale.ROOT).equals(record.content().category())) {
            return false;
        }
        if (tag != null && !tag.isBlank()
            && record.content().tags().stream().noneMatch(value -> value.equalsIgnoreCase(tag.trim()))) {
            return false;
        }
        if (createdFrom != null && record.createdAt().isBefore(createdFrom)) {
            return false;
        }
        return createdTo == null || !record.createdAt().isAfter(createdTo);
    }
}

package io.mnemo.core.profile;

import io.mnemo.core.record.MemoryRecord;
import java.time.Instant;
import java.util.List;

public record TimelineEntry(
    String recordId,
    Instant createdAt,
    String category,
    List<String> tags,
    String text,
    int accessCount,
    double memoryWeight,
    int reinforcementLevel
) {
    public static TimelineEntry from(MemoryRecord record) {
        return new TimelineEntry(
            record.id(),
            record.createdAt(),
            record.content().category(),
            record.content().tags(),
            record.text(),
            record.accessCount(),
            record.memoryWeight(),
            record.reinforcementLevel()
        );
    }
}

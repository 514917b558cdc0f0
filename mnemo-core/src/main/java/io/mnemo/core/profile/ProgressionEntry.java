package io.mnemo.core.profile;

import java.time.Instant;

public record ProgressionEntry(String recordId, Instant createdAt, String category, Long daysSincePrevious) {
}

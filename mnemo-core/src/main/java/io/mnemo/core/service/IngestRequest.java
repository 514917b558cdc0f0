package io.mnemo.core.service;

import java.time.Instant;
import java.util.List;

public record IngestRequest(String ownerId, String text, String category, List<String> tags, Instant createdAt) {
    public IngestRequest {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static IngestRequest of(String ownerId, String text) {
        return new IngestRequest(ownerId, text, null, List.of(), null);
    }
}

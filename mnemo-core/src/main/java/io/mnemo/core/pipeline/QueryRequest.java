package io.mnemo.core.pipeline;

import java.time.Instant;

public record QueryRequest(
    String ownerId,
    String queryText,
    Integer resultLimit,
    Double similarityFloor,
    Double timeWeight,
    Instant asOf
) {
    public static QueryRequest of(String ownerId, String queryText) {
        return new QueryRequest(ownerId, queryText, null, null, null, null);
    }

    public QueryRequest withAsOf(Instant value) {
        return new QueryRequest(ownerId, queryText, resultLimit, similarityFloor, timeWeight, value);
    }
}

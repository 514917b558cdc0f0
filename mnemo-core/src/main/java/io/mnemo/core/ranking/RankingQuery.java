package io.mnemo.core.ranking;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record RankingQuery(
    String ownerId,
    List<Double> queryEmbedding,
    int resultLimit,
    double similarityFloor,
    double timeWeight,
    Instant asOf
) {
    public static final int DEFAULT_RESULT_LIMIT = 10;
    public static final double DEFAULT_SIMILARITY_FLOOR = 0.5;
    public static final double DEFAULT_TIME_WEIGHT = 0.3;

    public RankingQuery {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(asOf, "asOf must not be null");
        queryEmbedding = queryEmbedding == null ? List.of() : List.copyOf(queryEmbedding);
        if (resultLimit <= 0) {
            throw new IllegalArgumentException("resultLimit must be > 0");
        }
        if (timeWeight < 0.0 || timeWeight > 1.0) {
            throw new IllegalArgumentException("timeWeight must be within [0, 1]");
        }
    }
}

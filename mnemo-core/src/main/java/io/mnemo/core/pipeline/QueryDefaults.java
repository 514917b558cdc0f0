package io.mnemo.core.pipeline;

import io.mnemo.core.ranking.RankingQuery;

public record QueryDefaults(int resultLimit, double similarityFloor, double timeWeight) {
    public static final QueryDefaults STANDARD = new QueryDefaults(
        RankingQuery.DEFAULT_RESULT_LIMIT,
        RankingQuery.DEFAULT_SIMILARITY_FLOOR,
        RankingQuery.DEFAULT_TIME_WEIGHT
    );
}

package io.mnemo.core.ranking;

import java.io.IOException;

public interface RankingEngine {
    RankingResult rank(RankingQuery query) throws IOException;
}

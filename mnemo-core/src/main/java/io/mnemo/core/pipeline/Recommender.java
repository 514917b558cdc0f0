package io.mnemo.core.pipeline;

import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.ranking.RankedCandidate;
import java.util.List;

public interface Recommender {
    List<String> recommend(String queryText, List<RankedCandidate> candidates, List<ForgottenInsight> insights);
}

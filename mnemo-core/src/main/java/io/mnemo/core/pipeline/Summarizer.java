package io.mnemo.core.pipeline;

import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.ranking.RankedCandidate;
import java.util.List;

public interface Summarizer {
    String summarize(String queryText, List<RankedCandidate> candidates, List<ForgottenInsight> insights);
}

package io.mnemo.core.insight;

import io.mnemo.core.ranking.RankedCandidate;
import java.io.IOException;
import java.util.List;

public interface InsightDetector {
    List<ForgottenInsight> detect(
        String ownerId,
        List<RankedCandidate> recentCandidates,
        List<RankedCandidate> oldCandidates,
        String queryText
    ) throws IOException;
}

package io.mnemo.core.ranking;

import java.util.List;

public record RankingResult(List<RankedCandidate> candidates, int recordsSearched) {
    public RankingResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static RankingResult empty() {
        return new RankingResult(List.of(), 0);
    }

    public List<RankedCandidate> recent() {
        return candidates.stream().filter(RankedCandidate::recent).toList();
    }

    public List<RankedCandidate> old() {
        return candidates.stream().filter(candidate -> !candidate.recent()).toList();
    }
}

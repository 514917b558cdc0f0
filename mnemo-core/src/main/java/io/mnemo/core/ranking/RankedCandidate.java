package io.mnemo.core.ranking;

import io.mnemo.core.record.MemoryRecord;

public record RankedCandidate(
    MemoryRecord record,
    double similarityScore,
    double recencyScore,
    double timeWeightedScore,
    double finalScore,
    long ageDays,
    AgeBucket ageBucket
) {
    public String recordId() {
        return record.id();
    }

    public boolean recent() {
        return ageBucket == AgeBucket.RECENT;
    }
}

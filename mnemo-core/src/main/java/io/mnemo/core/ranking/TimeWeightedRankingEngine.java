package io.mnemo.core.ranking;

import io.mnemo.core.embedding.VectorMath;
import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.record.OwnerLockRegistry;
import io.mnemo.core.record.RecordStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// final = ((1 - w) * similarity + w / (1 + ageDays)) * memoryWeight
public final class TimeWeightedRankingEngine implements RankingEngine {
    private static final Logger LOG = LoggerFactory.getLogger(TimeWeightedRankingEngine.class);

    static final Comparator<RankedCandidate> ORDER = Comparator
        .comparingDouble(RankedCandidate::finalScore).reversed()
        .thenComparing((RankedCandidate candidate) -> candidate.record().createdAt(), Comparator.reverseOrder())
        .thenComparing(RankedCandidate::recordId);

    private final RecordStore store;
    private final OwnerLockRegistry locks;

    public TimeWeightedRankingEngine(RecordStore store, OwnerLockRegistry locks) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
    }

    @Override
    public RankingResult rank(RankingQuery query) throws IOException {
        List<MemoryRecord> snapshot = locks.read(query.ownerId(), () -> store.findByOwner(query.ownerId()));
        if (snapshot.isEmpty()) {
            return RankingResult.empty();
        }

        List<RankedCandidate> scored = new ArrayList<>();
        for (MemoryRecord record : snapshot) {
            if (!query.ownerId().equals(record.ownerId())) {
                LOG.warn("Store returned record {} outside the requested owner scope, dropping it", record.id());
                continue;
            }
            double similarity = VectorMath.cosine(query.queryEmbedding(), record.embedding());
            if (similarity < query.similarityFloor()) {
                continue;
            }
            long ageDays = record.ageDays(query.asOf());
            double recency = recencyScore(ageDays);
            double timeWeighted = (1.0 - query.timeWeight()) * similarity + query.timeWeight() * recency;
            double finalScore = timeWeighted * record.memoryWeight();
            scored.add(new RankedCandidate(
                record,
                similarity,
                recency,
                timeWeighted,
                finalScore,
                ageDays,
                AgeBucket.of(ageDays)
            ));
        }

        List<RankedCandidate> ranked = scored.stream()
            .sorted(ORDER)
            .limit(query.resultLimit())
            .toList();
        LOG.debug("Ranked {} of {} records above floor {}, returning {}",
            scored.size(), snapshot.size(), query.similarityFloor(), ranked.size());
        return new RankingResult(ranked, snapshot.size());
    }

    static double recencyScore(long ageDays) {
        return 1.0 / (1.0 + Math.max(0L, ageDays));
    }
}

package io.mnemo.core.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.mnemo.core.record.InMemoryRecordStore;
import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.record.OwnerLockRegistry;
import io.mnemo.core.record.RecordContent;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TimeWeightedRankingEngineTest {
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private InMemoryRecordStore store;
    private TimeWeightedRankingEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        engine = new TimeWeightedRankingEngine(store, new OwnerLockRegistry());
    }

    @Test
    void shouldBlendSimilarityRecencyAndWeight() throws Exception {
        store.insert(new MemoryRecord("r1", "alice", RecordContent.text("a"), List.of(0.8, 0.6),
            NOW.minus(Duration.ofDays(9)), 2, 1.5, 0, null, null));

        RankingResult result = engine.rank(new RankingQuery("alice", List.of(1.0, 0.0), 10, 0.5, 0.3, NOW));

        assertThat(result.recordsSearched()).isEqualTo(1);
        RankedCandidate candidate = result.candidates().get(0);
        assertThat(candidate.similarityScore()).isCloseTo(0.8, within(1e-9));
        assertThat(candidate.recencyScore()).isCloseTo(0.1, within(1e-9));
        assertThat(candidate.timeWeightedScore()).isCloseTo(0.7 * 0.8 + 0.3 * 0.1, within(1e-9));
        assertThat(candidate.finalScore()).isCloseTo((0.7 * 0.8 + 0.3 * 0.1) * 1.5, within(1e-9));
        assertThat(candidate.ageDays()).isEqualTo(9);
        assertThat(candidate.ageBucket()).isEqualTo(AgeBucket.RECENT);
    }

    @Test
    void shouldDropCandidatesBelowSimilarityFloor() throws Exception {
        store.insert(MemoryRecord.create("close", "alice", RecordContent.text("a"), List.of(1.0, 0.0), NOW));
        store.insert(MemoryRecord.create("orthogonal", "alice", RecordContent.text("b"), List.of(0.0, 1.0), NOW));

        RankingResult result = engine.rank(new RankingQuery("alice", List.of(1.0, 0.0), 10, 0.5, 0.3, NOW));

        assertThat(result.candidates()).extracting(RankedCandidate::recordId).containsExactly("close");
        assertThat(result.recordsSearched()).isEqualTo(2);
    }

    @Test
    void shouldBreakTiesByNewerFirstThenId() throws Exception {
        Instant older = NOW.minus(Duration.ofDays(400));
        store.insert(MemoryRecord.create("b", "alice", RecordContent.text("x"), List.of(1.0, 0.0), older));
        store.insert(MemoryRecord.create("a", "alice", RecordContent.text("x"), List.of(1.0, 0.0), older));
        store.insert(MemoryRecord.create("c", "alice", RecordContent.text("x"), List.of(1.0, 0.0), older.plusSeconds(60)));

        RankingQuery query = new RankingQuery("alice", List.of(1.0, 0.0), 10, 0.5, 0.0, NOW);
        List<String> first = engine.rank(query).candidates().stream().map(RankedCandidate::recordId).toList();
        List<String> second = engine.rank(query).candidates().stream().map(RankedCandidate::recordId).toList();

        assertThat(first).containsExactly("c", "a", "b");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldApplyLimitAndBucketByAge() throws Exception {
        store.insert(MemoryRecord.create("recent", "alice", RecordContent.text("x"), List.of(1.0, 0.0),
            NOW.minus(Duration.ofDays(179))));
        store.insert(MemoryRecord.create("old", "alice", RecordContent.text("x"), List.of(1.0, 0.0),
            NOW.minus(Duration.ofDays(180))));
        store.insert(MemoryRecord.create("oldest", "alice", RecordContent.text("x"), List.of(1.0, 0.0),
            NOW.minus(Duration.ofDays(900))));

        RankingResult all = engine.rank(new RankingQuery("alice", List.of(1.0, 0.0), 10, 0.5, 0.3, NOW));
        RankingResult limited = engine.rank(new RankingQuery("alice", List.of(1.0, 0.0), 1, 0.5, 0.3, NOW));

        assertThat(all.recent()).extracting(RankedCandidate::recordId).containsExactly("recent");
        assertThat(all.old()).extracting(RankedCandidate::recordId).containsExactly("old", "oldest");
        assertThat(limited.candidates()).extracting(RankedCandidate::recordId).containsExactly("recent");
    }

    @Test
    void shouldNeverReturnAnotherOwnersRecords() throws Exception {
        store.insert(MemoryRecord.create("bob-1", "bob", RecordContent.text("x"), List.of(1.0, 0.0), NOW));

        RankingResult result = engine.rank(new RankingQuery("alice", List.of(1.0, 0.0), 10, -1.0, 0.3, NOW));

        assertThat(result.candidates()).isEmpty();
        assertThat(result.recordsSearched()).isZero();
    }

    @Test
    void shouldScoreRecencyAsInverseAge() {
        assertThat(TimeWeightedRankingEngine.recencyScore(0)).isEqualTo(1.0);
        assertThat(TimeWeightedRankingEngine.recencyScore(3)).isEqualTo(0.25);
    }
}

package io.mnemo.core.evolution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.mnemo.core.record.InMemoryRecordStore;
import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.record.OwnerLockRegistry;
import io.mnemo.core.record.RecordContent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemoryEvolutionEngineTest {
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private InMemoryRecordStore store;
    private MemoryEvolutionEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        engine = new MemoryEvolutionEngine(
            store,
            new OwnerLockRegistry(),
            ReinforcementPolicy.DEFAULT,
            DecayPolicy.DEFAULT,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void shouldLevelUpOnEveryThirdAccess() throws Exception {
        store.insert(new MemoryRecord("r1", "alice", RecordContent.text("x"), List.of(1.0), NOW, 2, 1.10, 0, null, null));

        ReinforcementOutcome outcome = engine.reinforce("alice", "r1").orElseThrow();

        assertThat(outcome.leveledUp()).isTrue();
        assertThat(outcome.record().accessCount()).isEqualTo(3);
        assertThat(outcome.record().memoryWeight()).isCloseTo(1.30, within(1e-9));
        assertThat(outcome.record().reinforcementLevel()).isEqualTo(1);
        assertThat(outcome.record().lastAccessedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldAddBaseIncrementWithoutLevelUp() throws Exception {
        store.insert(new MemoryRecord("r1", "alice", RecordContent.text("x"), List.of(1.0), NOW, 3, 1.30, 1, null, null));

        ReinforcementOutcome outcome = engine.reinforce("alice", "r1").orElseThrow();

        assertThat(outcome.leveledUp()).isFalse();
        assertThat(outcome.record().accessCount()).isEqualTo(4);
        assertThat(outcome.record().memoryWeight()).isCloseTo(1.35, within(1e-9));
        assertThat(outcome.record().reinforcementLevel()).isEqualTo(1);
    }

    @Test
    void shouldSkipMissingRecordWithoutFailing() throws Exception {
        assertThat(engine.reinforce("alice", "missing")).isEmpty();
    }

    @Test
    void shouldNotLoseConcurrentReinforcements() throws Exception {
        store.insert(MemoryRecord.create("r1", "alice", RecordContent.text("x"), List.of(1.0), NOW));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(executor.submit(() -> engine.reinforce("alice", "r1")));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        MemoryRecord record = store.find("alice", "r1").orElseThrow();
        assertThat(record.accessCount()).isEqualTo(50);
        assertThat(record.reinforcementLevel()).isEqualTo(16);
        assertThat(record.memoryWeight()).isCloseTo(1.0 + 50 * 0.05 + 16 * 0.15, within(1e-6));
    }

    @Test
    void shouldDecayOldRecordsAndProtectFrequentlyAccessedOnes() throws Exception {
        store.insert(new MemoryRecord("plain", "alice", RecordContent.text("x"), List.of(1.0),
            NOW.minus(Duration.ofDays(865)), 0, 1.0, 0, null, null));
        store.insert(new MemoryRecord("busy", "alice", RecordContent.text("x"), List.of(1.0),
            NOW.minus(Duration.ofDays(865)), 5, 1.0, 1, null, null));
        store.insert(new MemoryRecord("ancient", "alice", RecordContent.text("x"), List.of(1.0),
            NOW.minus(Duration.ofDays(2000)), 0, 2.0, 0, null, null));
        store.insert(MemoryRecord.create("young", "alice", RecordContent.text("x"), List.of(1.0),
            NOW.minus(Duration.ofDays(365))));

        MaintenanceReport report = engine.applyDecay("alice", NOW);

        assertThat(report.decayedCount()).isEqualTo(3);
        assertThat(report.protectedCount()).isEqualTo(1);
        assertThat(report.skippedYoungCount()).isEqualTo(1);
        assertThat(report.examinedCount()).isEqualTo(4);
        assertThat(store.find("alice", "plain").orElseThrow().memoryWeight()).isCloseTo(0.5, within(1e-9));
        assertThat(store.find("alice", "busy").orElseThrow().memoryWeight()).isCloseTo(0.7, within(1e-9));
        assertThat(store.find("alice", "ancient").orElseThrow().memoryWeight()).isCloseTo(0.6, within(1e-9));
        assertThat(store.find("alice", "young").orElseThrow().memoryWeight()).isEqualTo(1.0);
        assertThat(store.find("alice", "plain").orElseThrow().lastDecayedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldNotCompoundDecayWithinMaintenanceInterval() throws Exception {
        store.insert(MemoryRecord.create("plain", "alice", RecordContent.text("x"), List.of(1.0),
            NOW.minus(Duration.ofDays(865))));

        engine.applyDecay("alice", NOW);
        MaintenanceReport repeated = engine.applyDecay("alice", NOW.plus(Duration.ofHours(1)));

        assertThat(repeated.decayedCount()).isZero();
        assertThat(repeated.alreadyMaintainedCount()).isEqualTo(1);
        assertThat(store.find("alice", "plain").orElseThrow().memoryWeight()).isCloseTo(0.5, within(1e-9));

        MaintenanceReport nextDay = engine.applyDecay("alice", NOW.plus(Duration.ofDays(1)));
        assertThat(nextDay.decayedCount()).isEqualTo(1);
    }

    @Test
    void shouldAddIncrementOnFirstAccess() throws Exception {
        store.insert(MemoryRecord.create("r1", "alice", RecordContent.text("x"), List.of(1.0), NOW));

        ReinforcementOutcome outcome = engine.reinforce("alice", "r1").orElseThrow();

        assertThat(outcome.leveledUp()).isFalse();
        assertThat(outcome.record().accessCount()).isEqualTo(1);
        assertThat(outcome.record().memoryWeight()).isCloseTo(1.05, within(1e-9));
        assertThat(outcome.record().reinforcementLevel()).isZero();
    }

    @Test
    void shouldDecayTwoYearOldRecords() throws Exception {
        store.insert(new MemoryRecord("unused", "alice", RecordContent.text("x"), List.of(1.0),
            NOW.minus(Duration.ofDays(730)), 0, 1.0, 0, null, null));
        store.insert(new MemoryRecord("busy", "alice", RecordContent.text("x"), List.of(1.0),
            NOW.minus(Duration.ofDays(730)), 7, 1.5, 2, null, null));

        MaintenanceReport report = engine.applyDecay("alice", NOW);

        assertThat(report.decayedCount()).isEqualTo(2);
        assertThat(report.protectedCount()).isEqualTo(1);
        assertThat(store.find("alice", "unused").orElseThrow().memoryWeight()).isCloseTo(0.635, within(1e-9));
        assertThat(store.find("alice", "busy").orElseThrow().memoryWeight()).isGreaterThanOrEqualTo(1.05 - 1e-9);
        assertThat(store.find("alice", "busy").orElseThrow().accessCount()).isEqualTo(7);
    }

    @Test
    void shouldKeepWeightPositiveAcrossYearsOfDailyMaintenance() throws Exception {
        store.insert(MemoryRecord.create("a", "alice", RecordContent.text("x"), List.of(1.0),
            NOW.minus(Duration.ofDays(376))));
        store.insert(MemoryRecord.create("b", "alice", RecordContent.text("x"), List.of(1.0),
            NOW.minus(Duration.ofDays(366))));

        MaintenanceReport last = null;
        for (int day = 0; day <= 2000; day++) {
            last = engine.applyDecay("alice", NOW.plus(Duration.ofDays(day)));
        }

        assertThat(last.decayedCount()).isEqualTo(2);
        assertThat(store.find("alice", "a").orElseThrow().memoryWeight())
            .isEqualTo(DecayPolicy.DEFAULT_MINIMUM_WEIGHT);
        assertThat(store.find("alice", "b").orElseThrow().memoryWeight())
            .isEqualTo(DecayPolicy.DEFAULT_MINIMUM_WEIGHT);
    }
}

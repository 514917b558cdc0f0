package io.mnemo.core.evolution;

import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.record.OwnerLockRegistry;
import io.mnemo.core.record.RecordStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MemoryEvolutionEngine implements ReinforcementEngine {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryEvolutionEngine.class);

    private final RecordStore store;
    private final OwnerLockRegistry locks;
    private final ReinforcementPolicy reinforcementPolicy;
    private final DecayPolicy decayPolicy;
    private final Clock clock;

    public MemoryEvolutionEngine(RecordStore store, OwnerLockRegistry locks) {
        this(store, locks, ReinforcementPolicy.DEFAULT, DecayPolicy.DEFAULT, Clock.systemUTC());
    }

    public MemoryEvolutionEngine(
        RecordStore store,
        OwnerLockRegistry locks,
        ReinforcementPolicy reinforcementPolicy,
        DecayPolicy decayPolicy,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.reinforcementPolicy = reinforcementPolicy == null ? ReinforcementPolicy.DEFAULT : reinforcementPolicy;
        this.decayPolicy = decayPolicy == null ? DecayPolicy.DEFAULT : decayPolicy;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Optional<ReinforcementOutcome> reinforce(String ownerId, String recordId) throws IOException {
        return locks.write(ownerId, () -> {
            Optional<MemoryRecord> current = store.find(ownerId, recordId);
            if (current.isEmpty()) {
                LOG.debug("Skipping reinforcement of missing record {}", recordId);
                return Optional.empty();
            }
            MemoryRecord record = current.get();
            int accessCount = record.accessCount() + 1;
            double weight = record.memoryWeight() + reinforcementPolicy.accessIncrement();
            int level = record.reinforcementLevel();
            boolean leveledUp = reinforcementPolicy.levelsUp(accessCount);
            if (leveledUp) {
                weight += reinforcementPolicy.levelUpBonus();
                level += 1;
                LOG.debug("Record {} reached reinforcement level {} after {} accesses", recordId, level, accessCount);
            }
            MemoryRecord updated = store.update(record.withReinforcement(accessCount, weight, level, clock.instant()));
            return Optional.of(new ReinforcementOutcome(updated, leveledUp));
        });
    }

    @Override
    public MaintenanceReport applyDecay(String ownerId, Instant asOf) throws IOException {
        Instant effectiveAsOf = asOf == null ? clock.instant() : asOf;
        MaintenanceReport report = locks.write(ownerId, () -> decayAll(ownerId, effectiveAsOf));
        LOG.info(
            "Decay pass as of {}: decayed={} protected={} young={} alreadyMaintained={}",
            effectiveAsOf,
            report.decayedCount(),
            report.protectedCount(),
            report.skippedYoungCount(),
            report.alreadyMaintainedCount()
        );
        return report;
    }

    private MaintenanceReport decayAll(String ownerId, Instant asOf) throws IOException {
        List<MemoryRecord> records = store.findByOwner(ownerId);
        int decayed = 0;
        int protectedCount = 0;
        int young = 0;
        int alreadyMaintained = 0;
        for (MemoryRecord record : records) {
            long ageDays = record.ageDays(asOf);
            if (!decayPolicy.applies(ageDays)) {
                young++;
                continue;
            }
            if (recentlyDecayed(record, asOf)) {
                alreadyMaintained++;
                continue;
            }
            double weight = decayPolicy.decayedWeight(record.memoryWeight(), ageDays, record.accessCount());
            if (decayPolicy.protects(record.accessCount())) {
                protectedCount++;
            }
            store.update(record.withDecay(weight, asOf));
            decayed++;
        }
        return new MaintenanceReport(ownerId, decayed, protectedCount, young, alreadyMaintained, asOf);
    }

    private boolean recentlyDecayed(MemoryRecord record, Instant asOf) {
        Instant last = record.lastDecayedAt();
        if (last == null) {
            return false;
        }
        Duration since = Duration.between(last, asOf);
        return since.compareTo(decayPolicy.minimumMaintenanceInterval()) < 0;
    }
}

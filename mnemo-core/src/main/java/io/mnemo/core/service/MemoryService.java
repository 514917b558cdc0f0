package io.mnemo.core.service;

import io.mnemo.core.collaborator.CollaboratorCalls;
import io.mnemo.core.embedding.EmbeddingProvider;
import io.mnemo.core.error.ValidationException;
import io.mnemo.core.evolution.MaintenanceReport;
import io.mnemo.core.evolution.ReinforcementEngine;
import io.mnemo.core.observability.AuditEvent;
import io.mnemo.core.observability.ObservabilityService;
import io.mnemo.core.pipeline.QueryCancellation;
import io.mnemo.core.pipeline.QueryPipeline;
import io.mnemo.core.pipeline.QueryRequest;
import io.mnemo.core.pipeline.QueryResult;
import io.mnemo.core.pipeline.RequestValidator;
import io.mnemo.core.profile.MemoryProfile;
import io.mnemo.core.profile.MemoryProfileService;
import io.mnemo.core.profile.RecurringPattern;
import io.mnemo.core.profile.SymptomProgression;
import io.mnemo.core.profile.TimelineEntry;
import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.record.OwnerLockRegistry;
import io.mnemo.core.record.RecordContent;
import io.mnemo.core.record.RecordFilter;
import io.mnemo.core.record.RecordStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MemoryService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryService.class);

    private final RecordStore store;
    private final EmbeddingProvider embeddings;
    private final QueryPipeline pipeline;
    private final ReinforcementEngine evolution;
    private final MemoryProfileService profiles;
    private final OwnerLockRegistry locks;
    private final CollaboratorCalls calls;
    private final Duration embedTimeout;
    private final ObservabilityService observability;
    private final Clock clock;

    public MemoryService(
        RecordStore store,
        EmbeddingProvider embeddings,
        QueryPipeline pipeline,
        ReinforcementEngine evolution,
        MemoryProfileService profiles,
        OwnerLockRegistry locks,
        CollaboratorCalls calls,
        Duration embedTimeout,
        ObservabilityService observability,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.evolution = Objects.requireNonNull(evolution, "evolution must not be null");
        this.profiles = Objects.requireNonNull(profiles, "profiles must not be null");
        this.locks = Objects.requireNonNull(locks, "locks must not be null");
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
        this.embedTimeout = embedTimeout == null ? Duration.ofSeconds(10) : embedTimeout;
        this.observability = observability;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public MemoryRecord ingest(IngestRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        String ownerId = RequestValidator.ownerId(request.ownerId());
        String text = RequestValidator.text("text", request.text());
        Instant createdAt = request.createdAt() == null ? clock.instant() : request.createdAt();
        if (createdAt.isAfter(clock.instant().plus(Duration.ofMinutes(5)))) {
            throw new ValidationException("createdAt", "createdAt must not be in the future");
        }

        List<Double> vector = calls.call("embedding", embedTimeout, () -> embeddings.embed(text));
        MemoryRecord record = MemoryRecord.create(
            UUID.randomUUID().toString(),
            ownerId,
            new RecordContent(text, request.category(), request.tags()),
            vector,
            createdAt
        );
        MemoryRecord stored = locks.write(ownerId, () -> store.insert(record));
        LOG.debug("Ingested record {} ({} dims)", stored.id(), vector.size());
        audit(AuditEvent.RECORD_INGESTED, ownerId, Map.of("record_id", stored.id(), "category", stored.content().category()));
        return stored;
    }

    public QueryResult query(QueryRequest request) {
        return query(request, QueryCancellation.none());
    }

    public QueryResult query(QueryRequest request, QueryCancellation cancellation) {
        long started = System.nanoTime();
        QueryResult result = pipeline.run(request, cancellation);
        long durationMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        audit(AuditEvent.QUERY_COMPLETED, result.ownerId(), Map.of(
            "outcome", result.outcome().name(),
            "candidates", result.candidates() == null ? 0 : result.candidates().size(),
            "insights", result.insights() == null ? 0 : result.insights().size(),
            "reinforced", result.reinforcedCount(),
            "duration_ms", durationMs
        ));
        return result;
    }

    public MaintenanceReport maintain(String ownerId, Instant asOf) throws IOException {
        String owner = RequestValidator.ownerId(ownerId);
        MaintenanceReport report = evolution.applyDecay(owner, asOf == null ? clock.instant() : asOf);
        audit(AuditEvent.MAINTENANCE_COMPLETED, owner, Map.of(
            "decayed", report.decayedCount(),
            "protected", report.protectedCount(),
            "skipped_young", report.skippedYoungCount(),
            "already_maintained", report.alreadyMaintainedCount()
        ));
        return report;
    }

    public int purge(String ownerId) throws IOException {
        String owner = RequestValidator.ownerId(ownerId);
        int deleted = locks.writeAndRelease(owner, () -> store.deleteByOwner(owner));
        LOG.info("Purged {} records for an owner", deleted);
        audit(AuditEvent.OWNER_PURGED, owner, Map.of("deleted", deleted));
        return deleted;
    }

    public List<TimelineEntry> timeline(String ownerId, RecordFilter filter) throws IOException {
        return profiles.timeline(RequestValidator.ownerId(ownerId), filter == null ? RecordFilter.ALL : filter);
    }

    public MemoryProfile profile(String ownerId, Instant asOf) throws IOException {
        return profiles.profile(RequestValidator.ownerId(ownerId), asOf);
    }

    public List<RecurringPattern> patterns(String ownerId, int windowDays, Instant asOf) throws IOException {
        if (windowDays <= 0) {
            throw new ValidationException("windowDays", "window must be at least one day");
        }
        return profiles.patterns(RequestValidator.ownerId(ownerId), windowDays, asOf);
    }

    public SymptomProgression progression(String ownerId, String symptom, int windowDays, Instant asOf)
        throws IOException {
        String owner = RequestValidator.ownerId(ownerId);
        String needle = RequestValidator.text("symptom", symptom);
        if (windowDays <= 0) {
            throw new ValidationException("windowDays", "window must be at least one day");
        }
        return profiles.progression(owner, needle, windowDays, asOf);
    }

    public int count(String ownerId) throws IOException {
        return store.count(RequestValidator.ownerId(ownerId));
    }

    public ObservabilityService observability() {
        return observability;
    }

    public String embeddingModel() {
        return embeddings.modelVersion();
    }

    @Override
    public void close() throws Exception {
        calls.close();
        store.close();
    }

    private void audit(String type, String ownerId, Map<String, Object> attributes) {
        if (observability == null) {
            return;
        }
        try {
            observability.record(type, ownerId, attributes);
        } catch (IOException e) {
            LOG.warn("Failed to record audit event {}: {}", type, e.getMessage());
        }
    }
}

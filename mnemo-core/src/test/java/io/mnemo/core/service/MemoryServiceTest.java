package io.mnemo.core.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.collaborator.ExtractiveSummarizer;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.embedding.HashingEmbeddingProvider;
import io.mnemo.core.error.ValidationException;
import io.mnemo.core.evolution.MaintenanceReport;
import io.mnemo.core.observability.AuditEvent;
import io.mnemo.core.observability.InMemoryAuditStore;
import io.mnemo.core.observability.ObservabilityService;
import io.mnemo.core.pipeline.QueryOutcome;
import io.mnemo.core.pipeline.QueryRequest;
import io.mnemo.core.pipeline.QueryResult;
import io.mnemo.core.record.InMemoryRecordStore;
import io.mnemo.core.record.MemoryRecord;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MemoryServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

    private InMemoryRecordStore store;
    private InMemoryAuditStore audit;
    private MemoryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecordStore();
        audit = new InMemoryAuditStore();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = MemoryServiceFactory.create(
            MnemoConfig.defaults(),
            store,
            new HashingEmbeddingProvider(),
            new ExtractiveSummarizer(),
            new ObservabilityService(audit, clock),
            clock
        );
    }

    @AfterEach
    void tearDown() throws Exception {
        service.close();
    }

    @Test
    void shouldIngestAndAuditWithoutRecordText() throws Exception {
        MemoryRecord record = service.ingest(new IngestRequest(
            "alice", "  Knee pain after running  ", "Symptom", List.of("knee"), NOW.minus(Duration.ofDays(3))
        ));

        assertThat(record.text()).isEqualTo("Knee pain after running");
        assertThat(record.content().category()).isEqualTo("symptom");
        assertThat(record.embedding()).hasSize(HashingEmbeddingProvider.DEFAULT_DIMENSIONS);
        assertThat(record.createdAt()).isEqualTo(NOW.minus(Duration.ofDays(3)));
        assertThat(service.count("alice")).isEqualTo(1);

        AuditEvent event = audit.load().get(0);
        assertThat(event.type()).isEqualTo(AuditEvent.RECORD_INGESTED);
        assertThat(event.attributes()).containsEntry("record_id", record.id());
        assertThat(event.attributes().values()).doesNotContain("Knee pain after running");
    }

    @Test
    void shouldRejectInvalidIngestBeforeStoring() {
        assertThatThrownBy(() -> service.ingest(IngestRequest.of("alice", " ")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.ingest(IngestRequest.of("alice smith", "text")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.ingest(IngestRequest.of("alice", "<script>alert(1)</script>")))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.ingest(new IngestRequest("alice", "later", null, null, NOW.plus(Duration.ofDays(1)))))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("future");
        assertThat(store.count("alice")).isZero();
    }

    @Test
    void shouldQueryOnlyTheRequestedOwner() throws Exception {
        service.ingest(IngestRequest.of("alice", "Knee pain after running"));
        service.ingest(IngestRequest.of("bob", "Knee pain after running"));

        QueryResult result = service.query(new QueryRequest("alice", "knee pain", null, 0.0, null, null));

        assertThat(result.outcome()).isEqualTo(QueryOutcome.ACCEPTED);
        assertThat(result.candidates()).hasSize(1);
        assertThat(result.candidates().get(0).record().ownerId()).isEqualTo("alice");
        assertThat(store.findByOwner("bob").get(0).accessCount()).isZero();
        assertThat(service.observability().summary().queriesAccepted()).isEqualTo(1);
    }

    @Test
    void shouldCountEveryConcurrentRetrieval() throws Exception {
        MemoryRecord record = service.ingest(IngestRequest.of("alice", "Migraine with aura in the evening"));
        ExecutorService executor = Executors.newFixedThreadPool(10);
        try {
            List<Future<QueryResult>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                futures.add(executor.submit(() -> service.query(new QueryRequest("alice", "migraine aura", null, 0.0, null, null))));
            }
            for (Future<QueryResult> future : futures) {
                assertThat(future.get().reinforcedCount()).isEqualTo(1);
            }
        } finally {
            executor.shutdownNow();
        }

        MemoryRecord reinforced = store.find("alice", record.id()).orElseThrow();
        assertThat(reinforced.accessCount()).isEqualTo(50);
        assertThat(reinforced.reinforcementLevel()).isEqualTo(16);
    }

    @Test
    void shouldSurfaceForgottenRecommendationThroughQuery() throws Exception {
        service.ingest(new IngestRequest("alice", "Knee pain. Doctor recommended physical therapy.", "visit", List.of(),
            NOW.minus(Duration.ofDays(400))));
        service.ingest(new IngestRequest("alice", "Knee pain again while hiking", "symptom", List.of(),
            NOW.minus(Duration.ofDays(2))));

        QueryResult result = service.query(new QueryRequest("alice", "knee pain", null, 0.0, null, null));

        assertThat(result.insights()).hasSize(1);
        assertThat(result.insights().get(0).message())
            .isEqualTo("Unfollowed recommendation from 13 months ago: physical therapy.");
    }

    @Test
    void shouldMaintainAndPurgeIdempotently() throws Exception {
        service.ingest(new IngestRequest("alice", "Old allergy note", null, null, NOW.minus(Duration.ofDays(865))));
        service.ingest(IngestRequest.of("bob", "Unrelated"));

        MaintenanceReport report = service.maintain("alice", null);
        assertThat(report.decayedCount()).isEqualTo(1);
        assertThat(store.findByOwner("alice").get(0).memoryWeight()).isEqualTo(0.5);

        assertThat(service.purge("alice")).isEqualTo(1);
        assertThat(service.purge("alice")).isZero();
        assertThat(service.count("alice")).isZero();
        assertThat(service.count("bob")).isEqualTo(1);
        assertThat(service.query(new QueryRequest("alice", "allergy", null, -1.0, null, null)).candidates()).isEmpty();
    }

    @Test
    void shouldRejectNonPositivePatternWindow() {
        assertThatThrownBy(() -> service.patterns("alice", 0, null))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldValidateProgressionArguments() {
        assertThatThrownBy(() -> service.progression("alice", "  ", 30, null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("symptom");
        assertThatThrownBy(() -> service.progression("alice", "headache", 0, null))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.progression("bad owner", "headache", 30, null))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void shouldKeepEveryIngestedRecordAccountedForDuringPurges() throws Exception {
        int ingests = 200;
        ExecutorService executor = Executors.newFixedThreadPool(4);
        int purged = 0;
        try {
            List<Future<MemoryRecord>> stored = new ArrayList<>();
            List<Future<Integer>> purges = new ArrayList<>();
            for (int i = 0; i < ingests; i++) {
                String text = "Headache note " + i;
                stored.add(executor.submit(() -> service.ingest(IngestRequest.of("alice", text))));
                if (i % 10 == 0) {
                    purges.add(executor.submit(() -> service.purge("alice")));
                }
            }
            for (Future<MemoryRecord> future : stored) {
                future.get();
            }
            for (Future<Integer> future : purges) {
                purged += future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(purged + service.count("alice")).isEqualTo(ingests);
    }
}

package io.mnemo.core.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ObservabilityServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldComputeDashboardSummary() throws Exception {
        Clock clock = Clock.fixed(Instant.parse("2026-02-21T12:00:00Z"), ZoneOffset.UTC);
        ObservabilityService service = new ObservabilityService(
            new FileAuditStore(tempDir.resolve("audit/events.jsonl")),
            clock
        );

        service.record(AuditEvent.RECORD_INGESTED, "alice", Map.of("record_id", "r1"));
        service.record(AuditEvent.RECORD_INGESTED, "bob", Map.of("record_id", "r2"));
        service.record(AuditEvent.QUERY_COMPLETED, "alice",
            Map.of("outcome", "ACCEPTED", "duration_ms", 120, "candidates", 4, "insights", 1));
        service.record(AuditEvent.QUERY_COMPLETED, "alice",
            Map.of("outcome", "DEGRADED", "duration_ms", 900, "candidates", 0, "insights", 0));
        service.record(AuditEvent.QUERY_COMPLETED, "bob",
            Map.of("outcome", "REJECTED", "duration_ms", 3, "candidates", 0, "insights", 0));
        service.record(AuditEvent.MAINTENANCE_COMPLETED, "alice", Map.of("decayed", 7));
        service.record(AuditEvent.OWNER_PURGED, "bob", Map.of("deleted", 1));

        DashboardSummary summary = service.summary();

        assertThat(summary.queriesTotal()).isEqualTo(3);
        assertThat(summary.queriesAccepted()).isEqualTo(1);
        assertThat(summary.queriesRejected()).isEqualTo(1);
        assertThat(summary.queriesDegraded()).isEqualTo(1);
        assertThat(summary.degradedRate()).isEqualTo(33.33);
        assertThat(summary.p50LatencyMs()).isEqualTo(120.0);
        assertThat(summary.p95LatencyMs()).isEqualTo(900.0);
        assertThat(summary.averageCandidates()).isEqualTo(1.33);
        assertThat(summary.insightsSurfaced()).isEqualTo(1);
        assertThat(summary.recordsIngested()).isEqualTo(2);
        assertThat(summary.maintenancePasses()).isEqualTo(1);
        assertThat(summary.recordsDecayed()).isEqualTo(7);
        assertThat(summary.ownersPurged()).isEqualTo(1);
        assertThat(summary.activeOwners7d()).isEqualTo(2);
        assertThat(summary.auditEvents()).isEqualTo(7);
    }

    @Test
    void shouldSkipMalformedLinesAndReturnNewestFirst() throws Exception {
        Path file = tempDir.resolve("events.jsonl");
        FileAuditStore store = new FileAuditStore(file);
        new ObservabilityService(store, Clock.fixed(Instant.parse("2026-02-20T00:00:00Z"), ZoneOffset.UTC))
            .record(AuditEvent.RECORD_INGESTED, "alice", Map.of());
        Files.writeString(file, "not json" + System.lineSeparator(), StandardOpenOption.APPEND);
        ObservabilityService later = new ObservabilityService(store, Clock.fixed(Instant.parse("2026-02-21T00:00:00Z"), ZoneOffset.UTC));
        later.record(AuditEvent.OWNER_PURGED, "alice", Map.of("deleted", 1));

        assertThat(store.load()).hasSize(2);
        assertThat(later.recent(1)).extracting(AuditEvent::type).containsExactly(AuditEvent.OWNER_PURGED);
    }

    @Test
    void shouldReturnZeroesWithoutEvents() throws Exception {
        DashboardSummary summary = new ObservabilityService(new InMemoryAuditStore(), Clock.systemUTC()).summary();

        assertThat(summary.queriesTotal()).isZero();
        assertThat(summary.degradedRate()).isZero();
        assertThat(summary.p95LatencyMs()).isZero();
    }
}

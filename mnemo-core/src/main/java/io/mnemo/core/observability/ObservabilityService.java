package io.mnemo.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public final class ObservabilityService {
    private final AuditStore store;
    private final Clock clock;

    public ObservabilityService(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public AuditEvent record(String type, String ownerId, Map<String, Object> attributes) throws IOException {
        AuditEvent event = new AuditEvent(UUID.randomUUID().toString(), clock.instant(), type, ownerId, attributes);
        store.append(event);
        return event;
    }

    public List<AuditEvent> recent(int limit) throws IOException {
        return store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
            .limit(Math.max(1, limit))
            .toList();
    }

    public DashboardSummary summary() throws IOException {
        List<AuditEvent> all = store.load();
        Instant since7d = clock.instant().minus(Duration.ofDays(7));

        List<AuditEvent> queries = byType(all, AuditEvent.QUERY_COMPLETED);
        int accepted = countOutcome(queries, "ACCEPTED");
        int rejected = countOutcome(queries, "REJECTED");
        int degraded = countOutcome(queries, "DEGRADED");

        List<Double> latencies = queries.stream()
            .map(event -> toDouble(event.attributes().get("duration_ms")))
            .filter(value -> value != null && value >= 0)
            .sorted()
            .toList();
        double averageCandidates = queries.stream()
            .map(event -> toDouble(event.attributes().get("candidates")))
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average()
            .orElse(0.0);

        List<AuditEvent> maintenance = byType(all, AuditEvent.MAINTENANCE_COMPLETED);
        int activeOwners = (int) all.stream()
            .filter(event -> !event.timestamp().isBefore(since7d))
            .map(AuditEvent::ownerId)
            .filter(owner -> !owner.isBlank())
            .distinct()
            .count();

        return new DashboardSummary(
            queries.size(),
            accepted,
            rejected,
            degraded,
            round2(percentage(degraded, queries.size())),
            round2(percentile(latencies, 50)),
            round2(percentile(latencies, 95)),
            round2(averageCandidates),
            sum(queries, "insights"),
            byType(all, AuditEvent.RECORD_INGESTED).size(),
            maintenance.size(),
            sum(maintenance, "decayed"),
            byType(all, AuditEvent.OWNER_PURGED).size(),
            activeOwners,
            all.size()
        );
    }

    private List<AuditEvent> byType(List<AuditEvent> events, String type) {
        return events.stream().filter(event -> type.equalsIgnoreCase(event.type())).toList();
    }

    private int countOutcome(List<AuditEvent> queries, String outcome) {
        return (int) queries.stream()
            .filter(event -> outcome.equals(String.valueOf(event.attributes().get("outcome"))))
            .count();
    }

    private int sum(List<AuditEvent> events, String attribute) {
        return events.stream()
            .map(event -> toDouble(event.attributes().get(attribute)))
            .filter(Objects::nonNull)
            .mapToInt(Double::intValue)
            .sum();
    }

    private Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.ceil((percentile / 100.0) * sorted.size()) - 1;
        return sorted.get(Math.max(0, Math.min(sorted.size() - 1, index)));
    }

    private double percentage(int numerator, int denominator) {
        return denominator <= 0 ? 0.0 : (numerator * 100.0) / denominator;
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

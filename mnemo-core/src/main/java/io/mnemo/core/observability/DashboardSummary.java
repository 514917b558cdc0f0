package io.mnemo.core.observability;

public record DashboardSummary(
    int queriesTotal,
    int queriesAccepted,
    int queriesRejected,
    int queriesDegraded,
    double degradedRate,
    double p50LatencyMs,
    double p95LatencyMs,
    double averageCandidates,
    int insightsSurfaced,
    int recordsIngested,
    int maintenancePasses,
    int recordsDecayed,
    int ownersPurged,
    int activeOwners7d,
    int auditEvents
) {
}

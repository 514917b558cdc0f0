package io.mnemo.core.api;

import io.mnemo.core.evolution.MaintenanceReport;
import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.observability.DashboardSummary;
import io.mnemo.core.profile.MemoryProfile;
import io.mnemo.core.profile.RecurringPattern;
import io.mnemo.core.profile.SymptomProgression;
import io.mnemo.core.profile.TimelineEntry;
import io.mnemo.core.ranking.CandidateExplanations;
import io.mnemo.core.ranking.RankedCandidate;
import io.mnemo.core.pipeline.QueryResult;
import io.mnemo.core.record.MemoryRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ResponseMapper {

    public Map<String, Object> record(MemoryRecord record) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", record.id());
        out.put("owner_id", record.ownerId());
        out.put("text", record.text());
        out.put("category", record.content().category());
        out.put("tags", record.content().tags());
        out.put("created_at", record.createdAt().toString());
        out.put("access_count", record.accessCount());
        out.put("memory_weight", record.memoryWeight());
        out.put("reinforcement_level", record.reinforcementLevel());
        return out;
    }

    public Map<String, Object> queryResult(QueryResult result) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("owner_id", result.ownerId());
        out.put("outcome", result.outcome().name());
        out.put("degraded", result.degraded());
        out.put("records_searched", result.recordsSearched());
        out.put("candidates", result.candidates() == null ? null : result.candidates().stream().map(this::candidate).toList());
        out.put("recent_ids", ids(result.recent()));
        out.put("old_ids", ids(result.old()));
        out.put("insights", result.insights() == null ? null : result.insights().stream().map(this::insight).toList());
        out.put("summary", result.summary());
        out.put("recommendations", result.recommendations());
        out.put("reinforced_count", result.reinforcedCount());
        out.put("disclaimer", result.disclaimer());
        out.put("safety_flags", result.safetyFlags().stream()
            .map(flag -> Map.of("field", flag.field(), "phrase", flag.phrase(), "severity", flag.severity()))
            .toList());
        out.put("emergency_indicators", result.emergencyIndicators());
        out.put("safety_message", result.safetyMessage());
        out.put("failed_stages", result.failedStages().stream().map(Enum::name).toList());
        out.put("absent_fields", result.absentFields());
        out.put("trace", result.trace().stream().map(Enum::name).toList());
        return out;
    }

    public Map<String, Object> candidate(RankedCandidate candidate) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("record_id", candidate.recordId());
        out.put("text", candidate.record().text());
        out.put("category", candidate.record().content().category());
        out.put("created_at", candidate.record().createdAt().toString());
        out.put("similarity_score", candidate.similarityScore());
        out.put("recency_score", candidate.recencyScore());
        out.put("time_weighted_score", candidate.timeWeightedScore());
        out.put("final_score", candidate.finalScore());
        out.put("memory_weight", candidate.record().memoryWeight());
        out.put("age_days", candidate.ageDays());
        out.put("age_bucket", candidate.ageBucket().name());
        out.put("explanation", CandidateExplanations.explain(candidate));
        return out;
    }

    public Map<String, Object> insight(ForgottenInsight insight) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("kind", insight.kind().name());
        out.put("record_id", insight.recordId());
        out.put("age_days", insight.ageDays());
        out.put("action", insight.action());
        out.put("message", insight.message());
        return out;
    }

    public Map<String, Object> maintenance(MaintenanceReport report) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("owner_id", report.ownerId());
        out.put("as_of", report.asOf().toString());
        out.put("decayed_count", report.decayedCount());
        out.put("protected_count", report.protectedCount());
        out.put("skipped_young_count", report.skippedYoungCount());
        out.put("already_maintained_count", report.alreadyMaintainedCount());
        return out;
    }

    public Map<String, Object> timelineEntry(TimelineEntry entry) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("record_id", entry.recordId());
        out.put("created_at", entry.createdAt().toString());
        out.put("category", entry.category());
        out.put("tags", entry.tags());
        out.put("text", entry.text());
        out.put("access_count", entry.accessCount());
        out.put("memory_weight", entry.memoryWeight());
        out.put("reinforcement_level", entry.reinforcementLevel());
        return out;
    }

    public Map<String, Object> profile(MemoryProfile profile) {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", profile.health().status().name());
        health.put("score", profile.health().score());
        health.put("recency_score", profile.health().recencyScore());
        health.put("diversity_score", profile.health().diversityScore());
        health.put("continuity_score", profile.health().continuityScore());
        health.put("suggestions", profile.health().suggestions());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("owner_id", profile.ownerId());
        out.put("total_records", profile.totalRecords());
        out.put("categories", profile.categoryCounts());
        out.put("earliest", profile.earliest() == null ? null : profile.earliest().toString());
        out.put("latest", profile.latest() == null ? null : profile.latest().toString());
        out.put("span_days", profile.spanDays());
        out.put("health", health);
        return out;
    }

    public Map<String, Object> pattern(RecurringPattern pattern) {
        return Map.of(
            "category", pattern.category(),
            "count", pattern.count(),
            "window_days", pattern.windowDays(),
            "description", pattern.description()
        );
    }

    public Map<String, Object> progression(SymptomProgression progression) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("owner_id", progression.ownerId());
        out.put("symptom", progression.symptom());
        out.put("window_days", progression.windowDays());
        out.put("occurrences", progression.occurrences());
        out.put("first_occurrence", progression.firstOccurrence() == null ? null : progression.firstOccurrence().toString());
        out.put("latest_occurrence", progression.latestOccurrence() == null ? null : progression.latestOccurrence().toString());
        out.put("average_gap_days", progression.averageGapDays());
        out.put("trend", progression.trend().name());
        out.put("entries", progression.entries().stream().map(entry -> {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("record_id", entry.recordId());
            item.put("created_at", entry.createdAt().toString());
            item.put("category", entry.category());
            item.put("days_since_previous", entry.daysSincePrevious());
            return item;
        }).toList());
        return out;
    }

    public Map<String, Object> dashboard(DashboardSummary summary) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("queries_total", summary.queriesTotal());
        out.put("queries_accepted", summary.queriesAccepted());
        out.put("queries_rejected", summary.queriesRejected());
        out.put("queries_degraded", summary.queriesDegraded());
        out.put("degraded_rate", summary.degradedRate());
        out.put("p50_latency_ms", summary.p50LatencyMs());
        out.put("p95_latency_ms", summary.p95LatencyMs());
        out.put("average_candidates", summary.averageCandidates());
        out.put("insights_surfaced", summary.insightsSurfaced());
        out.put("records_ingested", summary.recordsIngested());
        out.put("maintenance_passes", summary.maintenancePasses());
        out.put("records_decayed", summary.recordsDecayed());
        out.put("owners_purged", summary.ownersPurged());
        out.put("active_owners_7d", summary.activeOwners7d());
        out.put("audit_events", summary.auditEvents());
        return out;
    }

    private List<String> ids(List<RankedCandidate> candidates) {
        return candidates == null ? null : candidates.stream().map(RankedCandidate::recordId).toList();
    }
}

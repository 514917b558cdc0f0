package io.mnemo.core.profile;

import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.record.RecordFilter;
import io.mnemo.core.record.RecordStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public final class MemoryProfileService {
    static final int RECENT_DAYS = 90;
    static final int IDEAL_CATEGORY_COUNT = 5;
    static final int IDEAL_GAP_DAYS = 180;
    static final int PATTERN_THRESHOLD = 3;

    private final RecordStore store;
    private final Clock clock;

    public MemoryProfileService(RecordStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public List<TimelineEntry> timeline(String ownerId, Instant from, Instant to) throws IOException {
        return timeline(ownerId, RecordFilter.between(from, to));
    }

    public List<TimelineEntry> timeline(String ownerId, RecordFilter filter) throws IOException {
        return store.findByOwner(ownerId, filter).stream()
            .map(TimelineEntry::from)
            .toList();
    }

    public MemoryProfile profile(String ownerId, Instant asOf) throws IOException {
        Instant now = asOf == null ? clock.instant() : asOf;
        List<MemoryRecord> records = store.findByOwner(ownerId);
        if (records.isEmpty()) {
            return new MemoryProfile(ownerId, 0, Map.of(), null, null, 0, MemoryHealth.EMPTY);
        }
        Map<String, Integer> categories = new TreeMap<>();
        records.forEach(record -> categories.merge(record.content().category(), 1, Integer::sum));
        Instant earliest = records.get(0).createdAt();
        Instant latest = records.get(records.size() - 1).createdAt();
        long span = Duration.between(earliest, latest).toDays();
        return new MemoryProfile(ownerId, records.size(), categories, earliest, latest, span, assess(records, now));
    }

    public List<RecurringPattern> patterns(String ownerId, int windowDays, Instant asOf) throws IOException {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be > 0");
        }
        Instant end = asOf == null ? clock.instant() : asOf;
        Instant start = end.minus(Duration.ofDays(windowDays));
        Map<String, Integer> counts = new TreeMap<>();
        store.findByOwner(ownerId, RecordFilter.between(start, end))
            .forEach(record -> counts.merge(record.content().category(), 1, Integer::sum));
        List<RecurringPattern> patterns = new ArrayList<>();
        counts.forEach((category, count) -> {
            if (count >= PATTERN_THRESHOLD) {
                patterns.add(new RecurringPattern(category, count, windowDays));
            }
        });
        return patterns;
    }

    public SymptomProgression progression(String ownerId, String symptom, int windowDays, Instant asOf)
        throws IOException {
        if (windowDays <= 0) {
            throw new IllegalArgumentException("windowDays must be > 0");
        }
        Instant end = asOf == null ? clock.instant() : asOf;
        Instant start = end.minus(Duration.ofDays(windowDays));
        String needle = symptom.toLowerCase(Locale.ROOT);
        List<MemoryRecord> matching = store.findByOwner(ownerId, RecordFilter.between(start, end)).stream()
            .filter(record -> mentions(record, needle))
            .toList();
        if (matching.isEmpty()) {
            return SymptomProgression.none(ownerId, symptom, windowDays);
        }

        List<ProgressionEntry> entries = new ArrayList<>();
        MemoryRecord previous = null;
        for (MemoryRecord record : matching) {
            Long gap = previous == null ? null : Duration.between(previous.createdAt(), record.createdAt()).toDays();
            entries.add(new ProgressionEntry(record.id(), record.createdAt(), record.content().category(), gap));
            previous = record;
        }
        Instant first = matching.get(0).createdAt();
        Instant latest = matching.get(matching.size() - 1).createdAt();
        double averageGap = matching.size() < 2 ? 0.0
            : Math.round(Duration.between(first, latest).toDays() * 10.0 / (matching.size() - 1)) / 10.0;
        ProgressionTrend trend = matching.size() >= PATTERN_THRESHOLD ? ProgressionTrend.RECURRING : ProgressionTrend.ISOLATED;
        return new SymptomProgression(ownerId, symptom, windowDays, matching.size(), first, latest, averageGap, trend, entries);
    }

    private static boolean mentions(MemoryRecord record, String needle) {
        if (record.text().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        return record.content().tags().stream().anyMatch(tag -> tag.toLowerCase(Locale.ROOT).equals(needle));
    }

    static MemoryHealth assess(List<MemoryRecord> chronological, Instant asOf) {
        int total = chronological.size();
        long recentCount = chronological.stream().filter(record -> record.ageDays(asOf) <= RECENT_DAYS).count();
        double recency = Math.min(1.0, recentCount / Math.max(1.0, total * 0.3));

        long categories = chronological.stream().map(record -> record.content().category()).distinct().count();
        double diversity = Math.min(1.0, categories / (double) IDEAL_CATEGORY_COUNT);

        double continuity;
        if (total > 1) {
            long gapDays = Duration.between(chronological.get(0).createdAt(), chronological.get(total - 1).createdAt()).toDays();
            double averageGap = gapDays / (double) (total - 1);
            continuity = Math.max(0.0, 1.0 - averageGap / IDEAL_GAP_DAYS);
        } else {
            continuity = 0.5;
        }

        double score = recency * 0.4 + diversity * 0.3 + continuity * 0.3;
        List<String> suggestions = new ArrayList<>();
        if (recency < 0.5) {
            suggestions.add("Add recent records to keep the history current.");
        }
        if (diversity < 0.4) {
            suggestions.add("Add different kinds of records (symptoms, reports, prescriptions) for better context.");
        }
        if (continuity < 0.4) {
            suggestions.add("Regular updates make patterns over time easier to spot.");
        }
        return new MemoryHealth(
            HealthStatus.fromScore(score),
            round(score),
            round(recency),
            round(diversity),
            round(continuity),
            suggestions
        );
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}

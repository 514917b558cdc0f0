package io.mnemo.core.insight;

import io.mnemo.core.ranking.RankedCandidate;
import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.record.RecordStore;
import java.io.IOException;
import java.time.Month;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ForgottenInsightDetector implements InsightDetector {
    private static final Logger LOG = LoggerFactory.getLogger(ForgottenInsightDetector.class);

    public static final List<String> DEFAULT_MARKERS = List.of(
        "recommended", "suggested", "advised", "referred", "follow-up", "follow up"
    );
    public static final int DEFAULT_MAX_INSIGHTS = 3;
    static final double HISTORICAL_SIMILARITY = 0.7;
    static final int HISTORICAL_MAX_RECENT = 1;
    static final int SEASONAL_MIN_RECORDS = 3;
    static final int SEASONAL_MAX_MONTHS = 3;
    private static final DateTimeFormatter MONTH_YEAR = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH)
        .withZone(ZoneOffset.UTC);

    private static final Set<String> LEADING_FILLER = Set.of("to", "a", "an", "for");
    private static final Set<String> INSIGNIFICANT = Set.of(
        "the", "and", "for", "with", "from", "that", "this", "was", "were", "are", "her", "his",
        "their", "your", "into", "onto", "some", "any", "per", "via"
    );
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?;\\n]");
    private static final Pattern WORD = Pattern.compile("[a-z0-9]+");

    private final RecordStore store;
    private final List<Pattern> markers;
    private final int maxInsights;

    public ForgottenInsightDetector(RecordStore store) {
        this(store, DEFAULT_MARKERS, DEFAULT_MAX_INSIGHTS);
    }

    public ForgottenInsightDetector(RecordStore store, List<String> markers, int maxInsights) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        List<String> source = markers == null || markers.isEmpty() ? DEFAULT_MARKERS : markers;
        this.markers = source.stream()
            .filter(marker -> marker != null && !marker.isBlank())
            .map(marker -> Pattern.compile("\\b" + Pattern.quote(marker.trim().toLowerCase(Locale.ROOT)) + "\\b"))
            .toList();
        this.maxInsights = maxInsights <= 0 ? DEFAULT_MAX_INSIGHTS : maxInsights;
    }

    @Override
    public List<ForgottenInsight> detect(
        String ownerId,
        List<RankedCandidate> recentCandidates,
        List<RankedCandidate> oldCandidates,
        String queryText
    ) throws IOException {
        if (oldCandidates == null || oldCandidates.isEmpty()) {
            return List.of();
        }
        List<RankedCandidate> recent = recentCandidates == null ? List.of() : recentCandidates;
        List<RankedCandidate> oldestFirst = oldCandidates.stream()
            .sorted(Comparator.comparingLong(RankedCandidate::ageDays).reversed()
                .thenComparing(RankedCandidate::recordId))
            .toList();

        List<MemoryRecord> history = null;
        Set<String> seenActions = new LinkedHashSet<>();
        List<ForgottenInsight> insights = new ArrayList<>();
        for (RankedCandidate candidate : oldestFirst) {
            if (insights.size() >= maxInsights) {
                break;
            }
            String action = extractAction(candidate.record().text());
            if (action == null) {
                continue;
            }
            String key = action.toLowerCase(Locale.ROOT);
            if (seenActions.contains(key)) {
                continue;
            }
            if (history == null) {
                history = store.findByOwner(ownerId);
            }
            if (followedThrough(action, candidate.record(), recent, history)) {
                LOG.debug("Action on record {} has follow-through, no insight", candidate.recordId());
                continue;
            }
            seenActions.add(key);
            insights.add(ForgottenInsight.unfollowed(candidate.recordId(), candidate.ageDays(), action));
        }
        if (insights.size() < maxInsights) {
            historicalMatch(oldCandidates, recent).ifPresent(insights::add);
        }
        if (insights.size() < maxInsights) {
            recurringSeason(oldestFirst).ifPresent(insights::add);
        }
        return List.copyOf(insights);
    }

    private Optional<ForgottenInsight> historicalMatch(List<RankedCandidate> ranked, List<RankedCandidate> recent) {
        if (recent.size() > HISTORICAL_MAX_RECENT) {
            return Optional.empty();
        }
        return ranked.stream()
            .filter(candidate -> candidate.similarityScore() > HISTORICAL_SIMILARITY)
            .findFirst()
            .map(match -> new ForgottenInsight(
                InsightKind.HISTORICAL_MATCH,
                match.recordId(),
                match.ageDays(),
                null,
                "Very similar " + match.record().content().category() + " documented " + (match.ageDays() / 30)
                    + " months ago (" + MONTH_YEAR.format(match.record().createdAt())
                    + ") with no recent follow-up on record."
            ));
    }

    private Optional<ForgottenInsight> recurringSeason(List<RankedCandidate> oldestFirst) {
        if (oldestFirst.size() < SEASONAL_MIN_RECORDS) {
            return Optional.empty();
        }
        Set<Month> months = new LinkedHashSet<>();
        oldestFirst.forEach(candidate -> months.add(candidate.record().createdAt().atZone(ZoneOffset.UTC).getMonth()));
        if (months.size() > SEASONAL_MAX_MONTHS) {
            return Optional.empty();
        }
        RankedCandidate oldest = oldestFirst.get(0);
        String names = months.stream()
            .sorted()
            .map(month -> month.getDisplayName(TextStyle.FULL, Locale.ENGLISH))
            .collect(Collectors.joining(", "));
        return Optional.of(new ForgottenInsight(
            InsightKind.RECURRING_SEASON,
            oldest.recordId(),
            oldest.ageDays(),
            null,
            "Recurring pattern: " + oldestFirst.size() + " similar older records, concentrated in " + names + "."
        ));
    }

    // text after the earliest marker up to the end of its sentence
    String extractAction(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        int bestStart = -1;
        int bestEnd = -1;
        for (Pattern marker : markers) {
            Matcher matcher = marker.matcher(lower);
            if (matcher.find() && (bestStart < 0 || matcher.start() < bestStart)) {
                bestStart = matcher.start();
                bestEnd = matcher.end();
            }
        }
        if (bestStart < 0) {
            return null;
        }
        String rest = text.substring(bestEnd);
        Matcher end = SENTENCE_END.matcher(rest);
        if (end.find()) {
            rest = rest.substring(0, end.start());
        }
        List<String> words = new ArrayList<>(List.of(rest.trim().replaceAll("^[\\s:,\\-]+", "").split("\\s+")));
        while (!words.isEmpty() && LEADING_FILLER.contains(words.get(0).toLowerCase(Locale.ROOT))) {
            words.remove(0);
        }
        String action = String.join(" ", words).replaceAll("[\\s,:\\-]+$", "").trim();
        return action.isEmpty() ? null : action;
    }

    private boolean followedThrough(
        String action,
        MemoryRecord origin,
        List<RankedCandidate> recent,
        List<MemoryRecord> history
    ) {
        for (RankedCandidate candidate : recent) {
            if (!candidate.recordId().equals(origin.id()) && mentions(candidate.record().text(), action)) {
                return true;
            }
        }
        for (MemoryRecord record : history) {
            if (record.createdAt().isAfter(origin.createdAt()) && mentions(record.text(), action)) {
                return true;
            }
        }
        return false;
    }

    static boolean mentions(String text, String action) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lowerText = text.toLowerCase(Locale.ROOT);
        String lowerAction = action.toLowerCase(Locale.ROOT);
        if (lowerText.contains(lowerAction)) {
            return true;
        }
        Set<String> required = significantWords(lowerAction);
        if (required.isEmpty()) {
            return false;
        }
        return significantWords(lowerText).containsAll(required);
    }

    private static Set<String> significantWords(String lower) {
        Set<String> words = new LinkedHashSet<>();
        Matcher matcher = WORD.matcher(lower);
        while (matcher.find()) {
            String word = matcher.group();
            if (word.length() > 2 && !INSIGNIFICANT.contains(word)) {
                words.add(word);
            }
        }
        return words;
    }
}

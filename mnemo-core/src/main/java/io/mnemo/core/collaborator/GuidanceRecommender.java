package io.mnemo.core.collaborator;

import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.insight.InsightKind;
import io.mnemo.core.pipeline.Recommender;
import io.mnemo.core.ranking.RankedCandidate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class GuidanceRecommender implements Recommender {
    public static final int MAX_RECOMMENDATIONS = 10;

    private static final Set<String> TREATMENT_CATEGORIES = Set.of("prescription", "treatment", "medication");

    @Override
    public List<String> recommend(String queryText, List<RankedCandidate> candidates, List<ForgottenInsight> insights) {
        String query = queryText == null ? "" : queryText.toLowerCase(Locale.ROOT);
        List<RankedCandidate> ranked = candidates == null ? List.of() : candidates;
        List<ForgottenInsight> forgotten = insights == null ? List.of() : insights;

        Set<String> out = new LinkedHashSet<>();
        out.addAll(questions(query, ranked, forgotten));
        out.addAll(monitoring(query, ranked));
        out.addAll(reminders(ranked));
        out.addAll(information(query, ranked));
        return out.stream().limit(MAX_RECOMMENDATIONS).toList();
    }

    private List<String> questions(String query, List<RankedCandidate> ranked, List<ForgottenInsight> forgotten) {
        List<String> questions = new ArrayList<>();
        List<RankedCandidate> recent = ranked.stream().filter(RankedCandidate::recent).toList();
        if (!recent.isEmpty()) {
            questions.add("Ask your clinician whether to review the pattern of the past 6 months together.");
            boolean treated = recent.stream()
                .anyMatch(candidate -> TREATMENT_CATEGORIES.contains(candidate.record().content().category()));
            if (treated) {
                questions.add("Ask how earlier treatments should shape the approach this time.");
            }
        }
        for (ForgottenInsight insight : forgotten) {
            if (insight.kind() == InsightKind.UNFOLLOWED_RECOMMENDATION) {
                questions.add("Ask whether the earlier suggestion of " + insight.action() + " is still relevant.");
            } else if (insight.kind() == InsightKind.RECURRING_SEASON) {
                questions.add("Ask whether this seasonal pattern calls for preventive steps.");
            }
        }
        if (query.contains("pain")) {
            questions.add("Ask which tests or examinations would help find the cause of this pain.");
        }
        if (query.contains("symptom")) {
            questions.add("Ask which warning signs would need immediate attention.");
        }
        return questions.stream().limit(3).toList();
    }

    private List<String> monitoring(String query, List<RankedCandidate> ranked) {
        List<String> suggestions = new ArrayList<>();
        suggestions.add("Keep a daily journal of intensity, duration and triggers.");
        if (ranked.size() >= 3) {
            suggestions.add("Note whether episodes happen at specific times or in specific situations.");
        }
        if (query.contains("pain")) {
            suggestions.add("Rate the pain from 1 to 10 and note what makes it better or worse.");
        }
        if (query.contains("headache") || query.contains("migraine")) {
            suggestions.add("Track possible headache triggers such as food, sleep, stress and weather.");
        }
        if (query.contains("sleep") || query.contains("insomnia") || query.contains("tired")) {
            suggestions.add("Track hours slept, wake times and sleep quality.");
        }
        return suggestions.stream().limit(3).toList();
    }

    private List<String> reminders(List<RankedCandidate> ranked) {
        List<String> reminders = new ArrayList<>();
        if (ranked.isEmpty()) {
            return reminders;
        }
        long newest = ranked.stream().mapToLong(RankedCandidate::ageDays).min().orElse(0);
        if (newest > 90) {
            reminders.add("Consider scheduling a check-up; the latest related record is over 3 months old.");
        }
        if (ranked.size() >= 3) {
            reminders.add("Schedule a follow-up to discuss the recurring pattern.");
        }
        reminders.add("Keep your list of current medications and supplements up to date.");
        return reminders.stream().limit(2).toList();
    }

    private List<String> information(String query, List<RankedCandidate> ranked) {
        List<String> actions = new ArrayList<>();
        if (!ranked.isEmpty()) {
            actions.add("Add recent test results or reports to keep the history complete.");
        }
        if (query.contains("allerg") || query.contains("reaction")) {
            actions.add("Document known allergies and any adverse reactions to medications or foods.");
        }
        if (query.contains("family") || query.contains("genetic") || query.contains("hereditary")) {
            actions.add("Gather family medical history for conditions that run in families.");
        }
        if (query.contains("medication") || query.contains("medicine") || query.contains("drug")) {
            actions.add("List all medications with dosages and start dates.");
        }
        return actions.stream().limit(2).toList();
    }
}

package io.mnemo.core.collaborator;

import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.pipeline.Summarizer;
import io.mnemo.core.ranking.RankedCandidate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

public final class ExtractiveSummarizer implements Summarizer {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    private static final int SNIPPET_LENGTH = 160;

    private final int maxSources;

    public ExtractiveSummarizer() {
        this(3);
    }

    public ExtractiveSummarizer(int maxSources) {
        this.maxSources = Math.max(1, maxSources);
    }

    @Override
    public String summarize(String queryText, List<RankedCandidate> candidates, List<ForgottenInsight> insights) {
        if (candidates == null || candidates.isEmpty()) {
            return "No related records were found in this history.";
        }
        long recent = candidates.stream().filter(RankedCandidate::recent).count();
        StringBuilder out = new StringBuilder()
            .append("Found ").append(candidates.size()).append(" related record")
            .append(candidates.size() == 1 ? "" : "s")
            .append(" (").append(recent).append(" recent, ").append(candidates.size() - recent).append(" older).");
        for (RankedCandidate candidate : candidates.subList(0, Math.min(maxSources, candidates.size()))) {
            out.append(' ')
                .append(DATE.format(candidate.record().createdAt()))
                .append(" [").append(candidate.record().content().category()).append("]: ")
                .append(snippet(candidate.record().text()));
        }
        if (insights != null && !insights.isEmpty()) {
            out.append(' ').append(insights.size()).append(" older item")
                .append(insights.size() == 1 ? " is" : "s are").append(" worth revisiting.");
        }
        return out.toString();
    }

    private static String snippet(String text) {
        String clean = text == null ? "" : text.replaceAll("\\s+", " ").trim();
        if (clean.length() <= SNIPPET_LENGTH) {
            return clean.endsWith(".") ? clean : clean + ".";
        }
        return clean.substring(0, SNIPPET_LENGTH - 3) + "...";
    }
}

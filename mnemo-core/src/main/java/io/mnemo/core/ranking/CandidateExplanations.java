package io.mnemo.core.ranking;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

public final class CandidateExplanations {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private CandidateExplanations() {
    }

    // e.g. "Very similar visit from 2025-01-25 (1 years ago) - tags: knee"
    public static String explain(RankedCandidate candidate) {
        StringBuilder out = new StringBuilder()
            .append(strength(candidate.similarityScore()))
            .append(' ')
            .append(candidate.record().content().category())
            .append(" from ")
            .append(DATE.format(candidate.record().createdAt()));

        long ageDays = candidate.ageDays();
        if (ageDays > 0) {
            if (ageDays < 30) {
                out.append(" (recent)");
            } else if (ageDays < 365) {
                out.append(" (").append(ageDays / 30).append(" months ago)");
            } else {
                out.append(" (").append(ageDays / 365).append(" years ago)");
            }
        }

        List<String> tags = candidate.record().content().tags();
        if (!tags.isEmpty()) {
            out.append(" - tags: ").append(String.join(", ", tags.subList(0, Math.min(2, tags.size()))));
        }
        return out.toString();
    }

    static String strength(double similarity) {
        if (similarity > 0.8) {
            return "Very similar";
        }
        if (similarity > 0.6) {
            return "Moderately similar";
        }
        return "Potentially related";
    }
}

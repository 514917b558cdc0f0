package io.mnemo.core.collaborator;

import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.pipeline.OutputValidator;
import io.mnemo.core.pipeline.QueryResult;
import io.mnemo.core.pipeline.SafetyFlag;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class SafetyOutputValidator implements OutputValidator {
    public static final List<String> DIAGNOSTIC_PHRASES = List.of(
        "you have", "you are diagnosed", "this is definitely", "you suffer from", "you are experiencing",
        "treatment for", "take this medication", "prescribe", "medical advice"
    );

    private final PiiRedactor redactor;
    private final String disclaimer;

    public SafetyOutputValidator() {
        this(new PiiRedactor(), DEFAULT_DISCLAIMER);
    }

    public SafetyOutputValidator(PiiRedactor redactor, String disclaimer) {
        this.redactor = redactor == null ? new PiiRedactor() : redactor;
        this.disclaimer = disclaimer == null || disclaimer.isBlank() ? DEFAULT_DISCLAIMER : disclaimer;
    }

    @Override
    public QueryResult validate(QueryResult draft) {
        List<SafetyFlag> flags = new ArrayList<>();

        String summary = redactor.redact(draft.summary());
        flag(QueryResult.FIELD_SUMMARY, summary, "warning", flags);

        List<String> recommendations = null;
        if (draft.recommendations() != null) {
            recommendations = new ArrayList<>();
            for (String recommendation : redactor.redactAll(draft.recommendations())) {
                if (flag(QueryResult.FIELD_RECOMMENDATIONS, recommendation, "removed", flags)) {
                    continue;
                }
                recommendations.add(recommendation);
            }
        }

        if (draft.insights() != null) {
            for (ForgottenInsight insight : draft.insights()) {
                flag(QueryResult.FIELD_INSIGHTS, insight.message(), "warning", flags);
            }
        }
        return draft.withValidatedOutput(summary, recommendations, disclaimer, flags);
    }

    private boolean flag(String field, String text, String severity, List<SafetyFlag> flags) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        boolean matched = false;
        for (String phrase : DIAGNOSTIC_PHRASES) {
            if (lower.contains(phrase)) {
                flags.add(new SafetyFlag(field, phrase, severity));
                matched = true;
            }
        }
        return matched;
    }
}

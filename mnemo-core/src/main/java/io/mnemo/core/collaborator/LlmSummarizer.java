package io.mnemo.core.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import io.mnemo.core.error.CollaboratorException;
import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.pipeline.Summarizer;
import io.mnemo.core.ranking.RankedCandidate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class LlmSummarizer implements Summarizer {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);
    private static final String SYSTEM_PROMPT = """
        You summarise a person's prior health records for them in plain language.
        Describe what the records say and how they relate to the question. Cite record dates.
        Never diagnose, never prescribe, and suggest discussing findings with a healthcare provider.
        """;

    private final OpenAiCompatClient client;
    private final String model;
    private final int maxTokens;

    public LlmSummarizer(OpenAiCompatClient client, String model, int maxTokens) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.maxTokens = maxTokens <= 0 ? 512 : maxTokens;
    }

    @Override
    public String summarize(String queryText, List<RankedCandidate> candidates, List<ForgottenInsight> insights) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("max_tokens", maxTokens);
        payload.put("temperature", 0.2);
        payload.put("messages", List.of(
            Map.of("role", "system", "content", SYSTEM_PROMPT),
            Map.of("role", "user", "content", userPrompt(queryText, candidates, insights))
        ));

        JsonNode root = client.post("chat/completions", payload);
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new CollaboratorException(client.name(), "completion contained no content");
        }
        return content.trim();
    }

    static String userPrompt(String queryText, List<RankedCandidate> candidates, List<ForgottenInsight> insights) {
        StringBuilder prompt = new StringBuilder("Question: ").append(queryText).append("\n\nRelated records:\n");
        if (candidates == null || candidates.isEmpty()) {
            prompt.append("(none)\n");
        } else {
            for (RankedCandidate candidate : candidates) {
                prompt.append("- ")
                    .append(DATE.format(candidate.record().createdAt()))
                    .append(" [").append(candidate.record().content().category()).append(", ")
                    .append(candidate.ageBucket().name().toLowerCase(Locale.ROOT)).append("] ")
                    .append(candidate.record().text())
                    .append('\n');
            }
        }
        if (insights != null && !insights.isEmpty()) {
            prompt.append("\nPossibly forgotten:\n");
            insights.forEach(insight -> prompt.append("- ").append(insight.message()).append('\n'));
        }
        return prompt.toString();
    }
}

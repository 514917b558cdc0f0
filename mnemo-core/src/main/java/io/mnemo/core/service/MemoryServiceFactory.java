package io.mnemo.core.service;

import io.mnemo.core.collaborator.CollaboratorCalls;
import io.mnemo.core.collaborator.ExtractiveSummarizer;
import io.mnemo.core.collaborator.GuidanceRecommender;
import io.mnemo.core.collaborator.KeywordInputGuard;
import io.mnemo.core.collaborator.LlmSummarizer;
import io.mnemo.core.collaborator.OpenAiCompatClient;
import io.mnemo.core.collaborator.PiiRedactor;
import io.mnemo.core.collaborator.SafetyOutputValidator;
import io.mnemo.core.config.model.EmbeddingConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.config.model.SummarizerConfig;
import io.mnemo.core.embedding.EmbeddingProvider;
import io.mnemo.core.embedding.HashingEmbeddingProvider;
import io.mnemo.core.embedding.OpenAiEmbeddingProvider;
import io.mnemo.core.evolution.MemoryEvolutionEngine;
import io.mnemo.core.insight.ForgottenInsightDetector;
import io.mnemo.core.observability.ObservabilityService;
import io.mnemo.core.pipeline.CollaboratorTimeouts;
import io.mnemo.core.pipeline.QueryDefaults;
import io.mnemo.core.pipeline.QueryPipeline;
import io.mnemo.core.pipeline.Summarizer;
import io.mnemo.core.profile.MemoryProfileService;
import io.mnemo.core.ranking.TimeWeightedRankingEngine;
import io.mnemo.core.record.OwnerLockRegistry;
import io.mnemo.core.record.RecordStore;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

public final class MemoryServiceFactory {

    private MemoryServiceFactory() {
    }

    public static MemoryService create(
        MnemoConfig config,
        RecordStore store,
        ObservabilityService observability,
        Clock clock
    ) {
        MnemoConfig effective = config == null ? MnemoConfig.defaults() : config;
        return create(effective, store, buildEmbeddingProvider(effective.collaborators().embedding()),
            buildSummarizer(effective.collaborators().summarizer()), observability, clock);
    }

    public static MemoryService create(
        MnemoConfig config,
        RecordStore store,
        EmbeddingProvider embeddings,
        Summarizer summarizer,
        ObservabilityService observability,
        Clock clock
    ) {
        Clock effectiveClock = clock == null ? Clock.systemUTC() : clock;
        OwnerLockRegistry locks = new OwnerLockRegistry(
            Duration.ofMillis(Math.max(1, config.storage().lockTimeoutMs())),
            config.storage().lockAttempts()
        );
        MemoryEvolutionEngine evolution = new MemoryEvolutionEngine(
            store,
            locks,
            config.evolution().reinforcementPolicy(),
            config.evolution().decayPolicy(),
            effectiveClock
        );
        CollaboratorTimeouts timeouts = new CollaboratorTimeouts(
            Duration.ofMillis(config.collaborators().embedding().timeoutMs()),
            Duration.ofMillis(config.collaborators().summarizer().timeoutMs()),
            Duration.ofMillis(config.collaborators().recommendTimeoutMs())
        );
        CollaboratorCalls calls = new CollaboratorCalls();
        QueryPipeline pipeline = new QueryPipeline(
            embeddings,
            new TimeWeightedRankingEngine(store, locks),
            evolution,
            new ForgottenInsightDetector(store, config.insights().markers(), config.insights().maxInsights()),
            new KeywordInputGuard(config.safety().emergencyKeywords()),
            summarizer,
            new GuidanceRecommender(),
            new SafetyOutputValidator(new PiiRedactor(), config.safety().disclaimer()),
            calls,
            timeouts,
            new QueryDefaults(
                config.ranking().resultLimit(),
                config.ranking().similarityFloor(),
                config.ranking().timeWeight()
            ),
            effectiveClock
        );
        return new MemoryService(
            store,
            embeddings,
            pipeline,
            evolution,
            new MemoryProfileService(store, effectiveClock),
            locks,
            calls,
            timeouts.embed(),
            observability,
            effectiveClock
        );
    }

    public static EmbeddingProvider buildEmbeddingProvider(EmbeddingConfig config) {
        String provider = normalize(config.provider(), "hashing");
        return switch (provider) {
            case "hashing" -> new HashingEmbeddingProvider(config.dimensions());
            case "openai" -> new OpenAiEmbeddingProvider(
                new OpenAiCompatClient(
                    "embedding",
                    config.apiKey(),
                    config.apiBase(),
                    Duration.ofMillis(config.timeoutMs()),
                    config.maxAttempts()
                ),
                config.model(),
                config.dimensions()
            );
            default -> throw new IllegalArgumentException("Unknown embedding provider: " + config.provider());
        };
    }

    public static Summarizer buildSummarizer(SummarizerConfig config) {
        String provider = normalize(config.provider(), "extractive");
        return switch (provider) {
            case "extractive" -> new ExtractiveSummarizer();
            case "llm" -> new LlmSummarizer(
                new OpenAiCompatClient(
                    "summarizer",
                    config.apiKey(),
                    config.apiBase(),
                    Duration.ofMillis(config.timeoutMs()),
                    config.maxAttempts()
                ),
                config.model(),
                config.maxTokens()
            );
            default -> throw new IllegalArgumentException("Unknown summarizer provider: " + config.provider());
        };
    }

    private static String normalize(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim().toLowerCase(Locale.ROOT);
    }
}

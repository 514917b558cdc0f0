package io.mnemo.core.pipeline;

import io.mnemo.core.collaborator.CollaboratorCalls;
import io.mnemo.core.embedding.EmbeddingProvider;
import io.mnemo.core.error.ConcurrencyConflictException;
import io.mnemo.core.evolution.ReinforcementEngine;
import io.mnemo.core.evolution.ReinforcementOutcome;
import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.insight.InsightDetector;
import io.mnemo.core.ranking.RankedCandidate;
import io.mnemo.core.ranking.RankingEngine;
import io.mnemo.core.ranking.RankingQuery;
import io.mnemo.core.ranking.RankingResult;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class QueryPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(QueryPipeline.class);

    private final EmbeddingProvider embeddings;
    private final RankingEngine rankingEngine;
    private final ReinforcementEngine reinforcementEngine;
    private final InsightDetector insightDetector;
    private final InputGuard inputGuard;
    private final Summarizer summarizer;
    private final Recommender recommender;
    private final OutputValidator outputValidator;
    private final CollaboratorCalls calls;
    private final CollaboratorTimeouts timeouts;
    private final QueryDefaults defaults;
    private final Clock clock;

    public QueryPipeline(
        EmbeddingProvider embeddings,
        RankingEngine rankingEngine,
        ReinforcementEngine reinforcementEngine,
        InsightDetector insightDetector,
        InputGuard inputGuard,
        Summarizer summarizer,
        Recommender recommender,
        OutputValidator outputValidator,
        CollaboratorCalls calls,
        CollaboratorTimeouts timeouts,
        QueryDefaults defaults,
        Clock clock
    ) {
        this.embeddings = Objects.requireNonNull(embeddings, "embeddings must not be null");
        this.rankingEngine = Objects.requireNonNull(rankingEngine, "rankingEngine must not be null");
        this.reinforcementEngine = Objects.requireNonNull(reinforcementEngine, "reinforcementEngine must not be null");
        this.insightDetector = Objects.requireNonNull(insightDetector, "insightDetector must not be null");
        this.inputGuard = Objects.requireNonNull(inputGuard, "inputGuard must not be null");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
        this.recommender = Objects.requireNonNull(recommender, "recommender must not be null");
        this.outputValidator = Objects.requireNonNull(outputValidator, "outputValidator must not be null");
        this.calls = Objects.requireNonNull(calls, "calls must not be null");
        this.timeouts = timeouts == null ? CollaboratorTimeouts.DEFAULT : timeouts;
        this.defaults = defaults == null ? QueryDefaults.STANDARD : defaults;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public QueryResult run(QueryRequest request) {
        return run(request, QueryCancellation.none());
    }

    public QueryResult run(QueryRequest request, QueryCancellation cancellation) {
        Objects.requireNonNull(request, "request must not be null");
        QueryCancellation signal = cancellation == null ? QueryCancellation.none() : cancellation;
        Run run = new Run();

        run.enter(PipelineState.VALIDATE_INPUT);
        String ownerId = RequestValidator.ownerId(request.ownerId());
        String queryText = RequestValidator.text("queryText", request.queryText());
        int limit = RequestValidator.resultLimit(
            request.resultLimit() == null ? defaults.resultLimit() : request.resultLimit()
        );
        double floor = RequestValidator.similarityFloor(
            request.similarityFloor() == null ? defaults.similarityFloor() : request.similarityFloor()
        );
        double timeWeight = RequestValidator.timeWeight(
            request.timeWeight() == null ? defaults.timeWeight() : request.timeWeight()
        );
        Instant asOf = request.asOf() == null ? clock.instant() : request.asOf();
        run.ownerId = ownerId;
        run.asOf = asOf;

        InputVerdict verdict = inputGuard.inspect(queryText);
        if (verdict.emergency()) {
            LOG.warn("Query rejected: emergency indicators {}", verdict.indicators());
            run.enter(PipelineState.REJECTED);
            return run.rejected(verdict);
        }

        signal.checkpoint(PipelineState.RETRIEVE);
        run.enter(PipelineState.RETRIEVE);
        if (!retrieve(run, queryText, new RankingSettings(limit, floor, timeWeight))) {
            return finish(run, signal, PipelineState.RETRIEVE);
        }

        signal.checkpoint(PipelineState.REINFORCE);
        run.enter(PipelineState.REINFORCE);
        reinforce(run);

        signal.checkpoint(PipelineState.SUMMARIZE);
        run.enter(PipelineState.SUMMARIZE);
        try {
            run.summary = calls.call(
                "summarizer",
                timeouts.summarize(),
                () -> summarizer.summarize(queryText, run.candidates, run.insights)
            );
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Summarize stage failed: {}", e.getMessage());
            return finish(run, signal, PipelineState.SUMMARIZE);
        }

        signal.checkpoint(PipelineState.RECOMMEND);
        run.enter(PipelineState.RECOMMEND);
        try {
            run.recommendations = calls.call(
                "recommender",
                timeouts.recommend(),
                () -> recommender.recommend(queryText, run.candidates, run.insights)
            );
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.warn("Recommend stage failed: {}", e.getMessage());
            return finish(run, signal, PipelineState.RECOMMEND);
        }

        return finish(run, signal, null);
    }

    private boolean retrieve(Run run, String queryText, RankingSettings settings) {
        try {
            List<Double> vector = calls.call("embedding", timeouts.embed(), () -> embeddings.embed(queryText));
            RankingResult ranking = rankingEngine.rank(new RankingQuery(
                run.ownerId,
                vector,
                settings.limit(),
                settings.floor(),
                settings.timeWeight(),
                run.asOf
            ));
            List<ForgottenInsight> insights = insightDetector.detect(
                run.ownerId,
                ranking.recent(),
                ranking.old(),
                queryText
            );
            run.recordsSearched = ranking.recordsSearched();
            run.candidates = ranking.candidates();
            run.insights = insights;
            return true;
        } catch (CancellationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Retrieve stage failed: {}", e.getMessage());
            return false;
        }
    }

    private void reinforce(Run run) {
        int reinforced = 0;
        for (RankedCandidate candidate : run.candidates) {
            try {
                Optional<ReinforcementOutcome> outcome = reinforcementEngine.reinforce(run.ownerId, candidate.recordId());
                if (outcome.isPresent()) {
                    reinforced++;
                }
            } catch (IOException | ConcurrencyConflictException e) {
                LOG.warn("Skipping reinforcement of record {}: {}", candidate.recordId(), e.getMessage());
            }
        }
        run.reinforcedCount = reinforced;
    }

    private QueryResult finish(Run run, QueryCancellation signal, PipelineState failedStage) {
        if (failedStage != null) {
            run.failedStages.add(failedStage);
            if (run.candidates == null) {
                run.absentFields.add(QueryResult.FIELD_CANDIDATES);
                run.absentFields.add(QueryResult.FIELD_INSIGHTS);
            }
            if (run.summary == null) {
                run.absentFields.add(QueryResult.FIELD_SUMMARY);
            }
            if (run.recommendations == null) {
                run.absentFields.add(QueryResult.FIELD_RECOMMENDATIONS);
            }
        }
        signal.checkpoint(PipelineState.VALIDATE_OUTPUT);
        run.enter(PipelineState.VALIDATE_OUTPUT);
        QueryOutcome outcome = failedStage == null ? QueryOutcome.ACCEPTED : QueryOutcome.DEGRADED;
        QueryResult draft = run.draft(outcome);
        QueryResult validated;
        try {
            validated = outputValidator.validate(draft);
        } catch (RuntimeException e) {
            LOG.warn("Output validation failed, withholding generated text: {}", e.getMessage());
            run.failedStages.add(PipelineState.VALIDATE_OUTPUT);
            run.summary = null;
            run.recommendations = null;
            addAbsent(run, QueryResult.FIELD_SUMMARY);
            addAbsent(run, QueryResult.FIELD_RECOMMENDATIONS);
            validated = run.draft(QueryOutcome.DEGRADED)
                .withValidatedOutput(null, null, OutputValidator.DEFAULT_DISCLAIMER, List.of());
        }
        run.enter(validated.outcome() == QueryOutcome.ACCEPTED ? PipelineState.DONE : PipelineState.DEGRADED);
        LOG.debug("Query finished as {} with {} candidates", validated.outcome(),
            validated.candidates() == null ? 0 : validated.candidates().size());
        return validated.withTrace(run.trace);
    }

    private static void addAbsent(Run run, String field) {
        if (!run.absentFields.contains(field)) {
            run.absentFields.add(field);
        }
    }

    private record RankingSettings(int limit, double floor, double timeWeight) {
    }

    private static final class Run {
        private final List<PipelineState> trace = new ArrayList<>();
        private final List<PipelineState> failedStages = new ArrayList<>();
        private final List<String> absentFields = new ArrayList<>();
        private String ownerId;
        private Instant asOf;
        private int recordsSearched;
        private List<RankedCandidate> candidates;
        private List<ForgottenInsight> insights;
        private String summary;
        private List<String> recommendations;
        private int reinforcedCount;

        private void enter(PipelineState state) {
            trace.add(state);
        }

        private QueryResult draft(QueryOutcome outcome) {
            return new QueryResult(
                ownerId,
                outcome,
                asOf,
                recordsSearched,
                candidates,
                insights,
                summary,
                recommendations,
                reinforcedCount,
                null,
                List.of(),
                List.of(),
                null,
                failedStages,
                absentFields,
                trace
            );
        }

        private QueryResult rejected(InputVerdict verdict) {
            return new QueryResult(
                ownerId,
                QueryOutcome.REJECTED,
                asOf,
                0,
                List.of(),
                List.of(),
                null,
                List.of(),
                0,
                OutputValidator.DEFAULT_DISCLAIMER,
                List.of(),
                verdict.indicators(),
                verdict.message(),
                List.of(),
                List.of(),
                trace
            );
        }
    }
}

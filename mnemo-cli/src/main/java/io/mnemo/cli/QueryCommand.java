package io.mnemo.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.api.ResponseMapper;
import io.mnemo.core.error.ValidationException;
import io.mnemo.core.insight.ForgottenInsight;
import io.mnemo.core.pipeline.QueryOutcome;
import io.mnemo.core.pipeline.QueryRequest;
import io.mnemo.core.pipeline.QueryResult;
import io.mnemo.core.ranking.CandidateExplanations;
import io.mnemo.core.ranking.RankedCandidate;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "query", description = "Rank an owner's records against a question")
public final class QueryCommand implements Callable<Integer> {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Parameters(index = "1..*", arity = "1..*", description = "Question text")
    List<String> words;

    @Option(names = {"-n", "--limit"}, description = "Maximum candidates")
    Integer limit;

    @Option(names = "--floor", description = "Similarity floor in [-1, 1]")
    Double floor;

    @Option(names = "--time-weight", description = "Recency blend in [0, 1]")
    Double timeWeight;

    @Option(names = "--as-of", description = "Evaluate ages as of this ISO-8601 instant")
    Instant asOf;

    @Option(names = "--json", description = "Print the full result as JSON")
    boolean json;

    public QueryCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            QueryResult result = context.service().query(
                new QueryRequest(ownerId, String.join(" ", words), limit, floor, timeWeight, asOf)
            );
            if (json) {
                ObjectMapper mapper = new ObjectMapper();
                System.out.println(mapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new ResponseMapper().queryResult(result)));
            } else {
                print(result);
            }
            return result.outcome() == QueryOutcome.DEGRADED ? 3 : 0;
        } catch (ValidationException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Query failed: " + e.getMessage());
            return 1;
        }
    }

    private void print(QueryResult result) {
        System.out.println("Outcome: " + result.outcome());
        if (result.outcome() == QueryOutcome.REJECTED) {
            System.out.println(result.safetyMessage());
            System.out.println(result.disclaimer());
            return;
        }
        if (result.degraded()) {
            System.out.println("Failed stages: " + result.failedStages());
            System.out.println("Absent fields: " + result.absentFields());
        }
        System.out.println("Records searched: " + result.recordsSearched());
        if (result.candidates() != null) {
            for (RankedCandidate candidate : result.candidates()) {
                System.out.printf(Locale.ROOT, "  %.3f  %s  %-6s  %s  %s%n",
                    candidate.finalScore(),
                    DATE.format(candidate.record().createdAt()),
                    candidate.ageBucket(),
                    candidate.recordId(),
                    candidate.record().text());
                System.out.println("         " + CandidateExplanations.explain(candidate));
            }
        }
        if (result.insights() != null) {
            for (ForgottenInsight insight : result.insights()) {
                System.out.println("Insight: " + insight.message());
            }
        }
        if (result.summary() != null) {
            System.out.println("Summary: " + result.summary());
        }
        if (result.recommendations() != null) {
            result.recommendations().forEach(recommendation -> System.out.println("- " + recommendation));
        }
        System.out.println(result.disclaimer());
    }
}

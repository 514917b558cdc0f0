package io.mnemo.cli;

import io.mnemo.core.error.ValidationException;
import io.mnemo.core.profile.MemoryHealth;
import io.mnemo.core.profile.MemoryProfile;
import io.mnemo.core.profile.RecurringPattern;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "profile", description = "Summarize an owner's history and its health")
public final class ProfileCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Option(names = "--as-of", description = "Evaluate as of this ISO-8601 instant")
    Instant asOf;

    @Option(names = "--window-days", description = "Window for recurring patterns", defaultValue = "30")
    int windowDays;

    public ProfileCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoryProfile profile = context.service().profile(ownerId, asOf);
            MemoryHealth health = profile.health();
            System.out.println("Records: " + profile.totalRecords());
            if (profile.totalRecords() > 0) {
                System.out.println("Span: " + profile.earliest() + " .. " + profile.latest() + " (" + profile.spanDays() + " days)");
                System.out.println("Categories: " + profile.categoryCounts());
            }
            System.out.println("Health: " + health.status() + " (" + health.score() + ")");
            System.out.println("  recency " + health.recencyScore()
                + ", diversity " + health.diversityScore()
                + ", continuity " + health.continuityScore());
            health.suggestions().forEach(suggestion -> System.out.println("  - " + suggestion));

            List<RecurringPattern> patterns = context.service().patterns(ownerId, windowDays, asOf);
            patterns.forEach(pattern -> System.out.println("Pattern: " + pattern.description()));
            return 0;
        } catch (ValidationException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Profile failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.mnemo.cli;

import io.mnemo.core.error.ValidationException;
import io.mnemo.core.profile.ProgressionEntry;
import io.mnemo.core.profile.SymptomProgression;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "progression", description = "Show how often a symptom appears in an owner's history")
public final class ProgressionCommand implements Callable<Integer> {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Parameters(index = "1..*", arity = "1..*", description = "Symptom text")
    List<String> words;

    @Option(names = "--window-days", description = "Look-back window in days", defaultValue = "365")
    int windowDays;

    @Option(names = "--as-of", description = "End of the window as an ISO-8601 instant")
    Instant asOf;

    public ProgressionCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            SymptomProgression progression = context.service()
                .progression(ownerId, String.join(" ", words), windowDays, asOf);
            System.out.println("Symptom: " + progression.symptom() + " (last " + progression.windowDays() + " days)");
            System.out.println("Occurrences: " + progression.occurrences() + ", trend " + progression.trend());
            if (progression.occurrences() == 0) {
                return 0;
            }
            System.out.println("First: " + DATE.format(progression.firstOccurrence())
                + ", latest: " + DATE.format(progression.latestOccurrence())
                + ", average gap: " + progression.averageGapDays() + " days");
            for (ProgressionEntry entry : progression.entries()) {
                String gap = entry.daysSincePrevious() == null ? "" : "  +" + entry.daysSincePrevious() + "d";
                System.out.println("  " + DATE.format(entry.createdAt()) + "  " + entry.category() + "  " + entry.recordId() + gap);
            }
            return 0;
        } catch (ValidationException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Progression failed: " + e.getMessage());
            return 1;
        }
    }
}

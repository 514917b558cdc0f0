package io.mnemo.cli;

import io.mnemo.core.error.ValidationException;
import io.mnemo.core.profile.TimelineEntry;
import io.mnemo.core.record.RecordFilter;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "timeline", description = "List an owner's records in chronological order")
public final class TimelineCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Option(names = "--from", description = "Earliest creation instant (ISO-8601)")
    Instant from;

    @Option(names = "--to", description = "Latest creation instant (ISO-8601)")
    Instant to;

    @Option(names = {"-c", "--category"}, description = "Only this category")
    String category;

    @Option(names = {"-t", "--tag"}, description = "Only records with this tag")
    String tag;

    public TimelineCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            List<TimelineEntry> entries = context.service().timeline(ownerId, new RecordFilter(category, tag, from, to));
            for (TimelineEntry entry : entries) {
                System.out.printf(Locale.ROOT, "%s  %-12s  w=%.2f  n=%d  %s%n",
                    entry.createdAt(),
                    entry.category(),
                    entry.memoryWeight(),
                    entry.accessCount(),
                    entry.text());
            }
            System.out.println(entries.size() + " records");
            return 0;
        } catch (ValidationException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Timeline failed: " + e.getMessage());
            return 1;
        }
    }
}

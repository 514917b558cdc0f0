package io.mnemo.cli;

import io.mnemo.core.error.ValidationException;
import io.mnemo.core.record.MemoryRecord;
import io.mnemo.core.service.IngestRequest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "ingest", description = "Store a new record for an owner")
public final class IngestCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Parameters(index = "1..*", arity = "1..*", description = "Record text")
    List<String> words;

    @Option(names = {"-c", "--category"}, description = "Record category (default: note)")
    String category;

    @Option(names = {"-t", "--tag"}, description = "Tag, repeatable")
    List<String> tags = new ArrayList<>();

    @Option(names = "--created-at", description = "ISO-8601 creation instant, for importing older records")
    Instant createdAt;

    public IngestCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MemoryRecord record = context.service().ingest(
                new IngestRequest(ownerId, String.join(" ", words), category, tags, createdAt)
            );
            System.out.println("Stored record " + record.id() + " [" + record.content().category() + "] at " + record.createdAt());
            return 0;
        } catch (ValidationException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Ingest failed: " + e.getMessage());
            return 1;
        }
    }
}

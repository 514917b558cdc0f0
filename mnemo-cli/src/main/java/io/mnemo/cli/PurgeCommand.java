package io.mnemo.cli;

import io.mnemo.core.error.ValidationException;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "purge", description = "Permanently delete every record of an owner")
public final class PurgeCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Option(names = "--yes", description = "Confirm the deletion")
    boolean confirmed;

    public PurgeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        if (!confirmed) {
            System.err.println("Refusing to purge without --yes");
            return 2;
        }
        try {
            int deleted = context.service().purge(ownerId);
            System.out.println("Deleted " + deleted + " records");
            return 0;
        } catch (ValidationException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Purge failed: " + e.getMessage());
            return 1;
        }
    }
}

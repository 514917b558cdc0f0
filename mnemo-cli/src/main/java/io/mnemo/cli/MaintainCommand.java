package io.mnemo.cli;

import io.mnemo.core.error.ValidationException;
import io.mnemo.core.evolution.MaintenanceReport;
import java.time.Instant;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "maintain", description = "Apply age-based decay to an owner's records")
public final class MaintainCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Owner id")
    String ownerId;

    @Option(names = "--as-of", description = "Decay as of this ISO-8601 instant (default: now)")
    Instant asOf;

    public MaintainCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MaintenanceReport report = context.service().maintain(ownerId, asOf);
            System.out.println("Decayed: " + report.decayedCount() + " (protected " + report.protectedCount() + ")");
            System.out.println("Too young to decay: " + report.skippedYoungCount());
            System.out.println("Already maintained: " + report.alreadyMaintainedCount());
            return 0;
        } catch (ValidationException e) {
            System.err.println("Invalid input: " + e.getMessage());
            return 2;
        } catch (Exception e) {
            System.err.println("Maintenance failed: " + e.getMessage());
            return 1;
        }
    }
}

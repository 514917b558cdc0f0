package io.mnemo.cli;

import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.observability.DashboardSummary;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and usage status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            MnemoConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Storage backend: " + config.storage().backend());
            System.out.println("Embedding model: " + context.service().embeddingModel());
            System.out.println("Summarizer: " + config.collaborators().summarizer().provider());
            System.out.println("Ranking: limit=" + config.ranking().resultLimit()
                + " floor=" + config.ranking().similarityFloor()
                + " timeWeight=" + config.ranking().timeWeight());
            if (context.service().observability() != null) {
                DashboardSummary summary = context.service().observability().summary();
                System.out.println("Queries: " + summary.queriesTotal()
                    + " (degraded " + summary.queriesDegraded() + ", rejected " + summary.queriesRejected() + ")");
                System.out.println("Records ingested: " + summary.recordsIngested());
                System.out.println("Maintenance passes: " + summary.maintenancePasses());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

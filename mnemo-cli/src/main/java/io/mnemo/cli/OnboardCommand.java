package io.mnemo.cli;

import io.mnemo.core.config.OnboardResult;
import io.mnemo.core.config.model.MnemoConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "onboard", description = "Write the config file and prepare the record data directory")
public final class OnboardCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--overwrite", description = "Replace an existing config with defaults")
    boolean overwrite;

    public OnboardCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        OnboardResult result;
        try {
            result = context.configService().onboard(context.configPath(), overwrite);
        } catch (Exception e) {
            System.err.println("Onboard failed: " + e.getMessage());
            return 1;
        }

        String action = result.createdConfig() ? "Created config: "
            : result.overwrittenConfig() ? "Overwrote config with defaults: "
            : "Refreshed config with new defaults: ";
        System.out.println(action + result.configPath());
        System.out.println("Data directory ready: " + result.dataDirectory());

        try {
            MnemoConfig config = context.configService().load(result.configPath());
            System.out.println("Record store: " + config.storage().backend());
            System.out.println("Embeddings: " + config.collaborators().embedding().provider()
                + ", summaries: " + config.collaborators().summarizer().provider());
        } catch (Exception e) {
            System.err.println("Config written but could not be read back: " + e.getMessage());
            return 1;
        }
        return 0;
    }
}

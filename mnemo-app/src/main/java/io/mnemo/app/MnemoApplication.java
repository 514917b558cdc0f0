package io.mnemo.app;

import io.mnemo.cli.CliContext;
import io.mnemo.cli.GatewayCommand;
import io.mnemo.cli.IngestCommand;
import io.mnemo.cli.MaintainCommand;
import io.mnemo.cli.MnemoCliCommand;
import io.mnemo.cli.OnboardCommand;
import io.mnemo.cli.ProfileCommand;
import io.mnemo.cli.ProgressionCommand;
import io.mnemo.cli.PurgeCommand;
import io.mnemo.cli.QueryCommand;
import io.mnemo.cli.StatusCommand;
import io.mnemo.cli.TimelineCommand;
import io.mnemo.core.api.GatewayServer;
import io.mnemo.core.config.ConfigPaths;
import io.mnemo.core.config.ConfigService;
import io.mnemo.core.config.model.GatewayConfig;
import io.mnemo.core.config.model.MnemoConfig;
import io.mnemo.core.observability.FileAuditStore;
import io.mnemo.core.observability.ObservabilityService;
import io.mnemo.core.record.InMemoryRecordStore;
import io.mnemo.core.record.RecordStore;
import io.mnemo.core.record.SqliteRecordStore;
import io.mnemo.core.service.MemoryService;
import io.mnemo.core.service.MemoryServiceFactory;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class MnemoApplication {
    private static final Logger LOG = LoggerFactory.getLogger(MnemoApplication.class);

    private MnemoApplication() {
    }

    public static void main(String[] args) throws Exception {
        ConfigService configService = new ConfigService();
        Path configPath = resolveConfigPath();
        MnemoConfig config = loadConfig(configService, configPath);
        Path baseDirectory = configPath.toAbsolutePath().getParent();

        ObservabilityService observability = new ObservabilityService(
            new FileAuditStore(ConfigPaths.resolve(config.storage().auditPath(), baseDirectory)),
            Clock.systemUTC()
        );
        RecordStore store = buildRecordStore(config, baseDirectory);

        int exitCode;
        try (MemoryService service = MemoryServiceFactory.create(config, store, observability, Clock.systemUTC())) {
            CliContext context = new CliContext(
                service,
                configService,
                configPath,
                (port, hostOverride) -> runGateway(config.gateway(), port, hostOverride, service)
            );

            CommandLine commandLine = new CommandLine(new MnemoCliCommand());
            commandLine.addSubcommand("onboard", new OnboardCommand(context));
            commandLine.addSubcommand("ingest", new IngestCommand(context));
            commandLine.addSubcommand("query", new QueryCommand(context));
            commandLine.addSubcommand("maintain", new MaintainCommand(context));
            commandLine.addSubcommand("purge", new PurgeCommand(context));
            commandLine.addSubcommand("timeline", new TimelineCommand(context));
            commandLine.addSubcommand("profile", new ProfileCommand(context));
            commandLine.addSubcommand("progression", new ProgressionCommand(context));
            commandLine.addSubcommand("status", new StatusCommand(context));
            commandLine.addSubcommand("gateway", new GatewayCommand(context));

            exitCode = commandLine.execute(args);
        }
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        String raw = System.getenv("MNEMO_CONFIG");
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        return ConfigPaths.resolve(raw.trim(), Path.of("").toAbsolutePath());
    }

    private static MnemoConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Falling back to default config, {} could not be read: {}", configPath, e.getMessage());
            return MnemoConfig.defaults();
        }
    }

    private static RecordStore buildRecordStore(MnemoConfig config, Path baseDirectory) {
        String backend = System.getenv().getOrDefault("MNEMO_STORE", config.storage().backend())
            .trim()
            .toLowerCase(Locale.ROOT);
        if ("memory".equals(backend)) {
            return new InMemoryRecordStore();
        }
        if (!"sqlite".equals(backend)) {
            throw new IllegalStateException("Unknown storage backend: " + backend);
        }
        Path sqlitePath = resolveSqlitePath(config, baseDirectory);
        try {
            return new SqliteRecordStore(sqlitePath);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize SQLite record store at " + sqlitePath, e);
        }
    }

    private static Path resolveSqlitePath(MnemoConfig config, Path baseDirectory) {
        String raw = System.getenv("MNEMO_SQLITE_PATH");
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.resolve(config.storage().sqlitePath(), baseDirectory);
        }
        return ConfigPaths.resolve(raw.trim(), baseDirectory);
    }

    private static int runGateway(GatewayConfig gateway, int port, String hostOverride, MemoryService service) throws Exception {
        int effectivePort = port > 0 ? port : gateway.port();
        String host = hostOverride == null || hostOverride.isBlank() ? gateway.host() : hostOverride;

        CountDownLatch shutdown = new CountDownLatch(1);
        try (GatewayServer server = new GatewayServer(effectivePort, host, service)) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            System.out.println("Gateway started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: GET /healthz, GET /dashboard/summary, GET /audit/events, "
                + "POST|GET /owners/{id}/records, POST /owners/{id}/query, POST /owners/{id}/maintain, "
                + "GET /owners/{id}/profile, GET /owners/{id}/patterns, DELETE /owners/{id}");
            shutdown.await();
        }
        return 0;
    }
}

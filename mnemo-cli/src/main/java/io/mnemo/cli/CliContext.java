package io.mnemo.cli;

import io.mnemo.core.config.ConfigService;
import io.mnemo.core.service.MemoryService;
import java.nio.file.Path;

public record CliContext(
    MemoryService service,
    ConfigService configService,
    Path configPath,
    GatewayRunner gatewayRunner
) {
    public CliContext(MemoryService service, ConfigService configService, Path configPath) {
        this(service, configService, configPath, (port, host) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}

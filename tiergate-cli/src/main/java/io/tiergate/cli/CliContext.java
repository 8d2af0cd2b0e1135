package io.tiergate.cli;

import io.tiergate.core.config.ConfigService;
import io.tiergate.core.runtime.EntitlementRuntime;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Clock clock,
    ServerRunner serverRunner
) {
    public CliContext(ConfigService configService, Path configPath, Clock clock) {
        this(configService, configPath, clock, (host, port) -> {
            throw new UnsupportedOperationException("server runner is not configured");
        });
    }

    public EntitlementRuntime openRuntime() throws IOException {
        return EntitlementRuntime.create(configService.load(configPath), clock);
    }
}

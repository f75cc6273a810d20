package io.minicron.cli;

import io.minicron.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    ServerRunner serverRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, (host, port) -> {
            throw new UnsupportedOperationException("server runner is not configured");
        });
    }
}

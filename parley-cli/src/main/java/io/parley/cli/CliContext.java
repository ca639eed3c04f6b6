package io.parley.cli;

import io.parley.core.chat.ChatService;
import io.parley.core.config.ConfigService;
import java.nio.file.Path;

public record CliContext(
    ChatService chatService,
    ConfigService configService,
    Path configPath,
    GatewayRunner gatewayRunner
) {
    public CliContext(ChatService chatService, ConfigService configService, Path configPath) {
        this(chatService, configService, configPath, (host, port) -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}

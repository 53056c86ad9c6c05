package io.llmbridge.cli;

import io.llmbridge.core.config.ConfigService;
import io.llmbridge.core.config.model.LlmBridgeConfig;
import io.llmbridge.core.credential.CredentialResolver;
import io.llmbridge.core.provider.ProviderCatalog;
import io.llmbridge.core.retry.RetryOrchestrator;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    CredentialResolver credentials
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, CredentialResolver.fromEnvironment());
    }

    public LlmBridgeConfig loadConfig() throws IOException {
        return configService.load(configPath);
    }

    public ProviderCatalog catalog(LlmBridgeConfig config) {
        return new ProviderCatalog(config, credentials);
    }

    public RetryOrchestrator orchestrator(LlmBridgeConfig config) {
        return new RetryOrchestrator(config.retry().toPolicy());
    }
}

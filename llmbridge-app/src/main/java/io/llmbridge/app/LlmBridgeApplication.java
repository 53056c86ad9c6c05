package io.llmbridge.app;

import io.llmbridge.cli.ChatCommand;
import io.llmbridge.cli.CliContext;
import io.llmbridge.cli.CoherencyCommand;
import io.llmbridge.cli.LlmBridgeCliCommand;
import io.llmbridge.cli.ProvidersCommand;
import io.llmbridge.cli.StatusCommand;
import io.llmbridge.core.config.ConfigPaths;
import io.llmbridge.core.config.ConfigService;
import io.llmbridge.core.credential.CredentialResolver;
import java.nio.file.Path;
import picocli.CommandLine;

public final class LlmBridgeApplication {

    private LlmBridgeApplication() {
    }

    public static void main(String[] args) {
        Path configPath = System.getenv("LLMBRIDGE_CONFIG") == null
            ? ConfigPaths.defaultConfigPath()
            : Path.of(System.getenv("LLMBRIDGE_CONFIG"));
        CliContext context = new CliContext(new ConfigService(), configPath, CredentialResolver.fromEnvironment());

        int exitCode = new CommandLine(new LlmBridgeCliCommand())
            .addSubcommand("chat", new ChatCommand(context))
            .addSubcommand("coherency", new CoherencyCommand(context))
            .addSubcommand("providers", new ProvidersCommand(context))
            .addSubcommand("status", new StatusCommand(context))
            .execute(args);
        System.exit(exitCode);
    }
}

package io.llmbridge.cli;

import io.llmbridge.core.config.model.LlmBridgeConfig;
import io.llmbridge.core.provider.ProviderCatalog;
import io.llmbridge.core.provider.ProviderDefinition;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "providers", description = "List built-in providers and whether a key is available")
public final class ProvidersCommand implements Callable<Integer> {
    private final CliContext context;

    public ProvidersCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LlmBridgeConfig config = context.loadConfig();
            ProviderCatalog catalog = context.catalog(config);
            for (ProviderDefinition definition : ProviderCatalog.DEFINITIONS) {
                String apiBase = config.providers().settingsFor(definition.name()).hasApiBase()
                    ? config.providers().settingsFor(definition.name()).apiBase()
                    : definition.apiBase();
                System.out.printf(
                    "%-11s %-52s %-20s %s%n",
                    definition.name(),
                    apiBase,
                    definition.apiKeyEnv(),
                    catalog.hasCredential(definition) ? "key available" : "no key"
                );
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Providers command failed: " + e.getMessage());
            return 1;
        }
    }
}

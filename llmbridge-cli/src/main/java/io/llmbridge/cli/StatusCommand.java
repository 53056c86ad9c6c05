package io.llmbridge.cli;

import io.llmbridge.core.config.model.LlmBridgeConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LlmBridgeConfig config = context.loadConfig();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Max retries: " + config.retry().maxRetries());
            System.out.println("Backoff: base " + config.retry().baseDelay() + ", cap " + config.retry().maxDelay()
                + ", jitter " + config.retry().jitterRatio());
            System.out.println("Connect timeout: " + config.http().connectTimeout());
            System.out.println("Read timeout: " + config.http().readTimeout());
            System.out.println("Coherency workers: " + config.coherency().numWorkers());
            System.out.println("Judge: " + config.coherency().judgeProvider() + " / " + config.coherency().judgeModel());
            System.out.println("OpenRouter configured: " + config.providers().openrouter().configured());
            System.out.println("OpenAI configured: " + config.providers().openai().configured());
            System.out.println("Google configured: " + config.providers().google().configured());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}

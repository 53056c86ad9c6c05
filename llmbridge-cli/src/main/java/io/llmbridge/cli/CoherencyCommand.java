package io.llmbridge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmbridge.core.coherency.CoherencyReport;
import io.llmbridge.core.coherency.CoherencyResult;
import io.llmbridge.core.coherency.CoherencyRun;
import io.llmbridge.core.coherency.CoherencyTester;
import io.llmbridge.core.coherency.LlmResponseJudge;
import io.llmbridge.core.coherency.PromptSuite;
import io.llmbridge.core.coherency.RequestOverrides;
import io.llmbridge.core.coherency.ResponseJudge;
import io.llmbridge.core.config.ConfigPaths;
import io.llmbridge.core.config.model.CoherencySettings;
import io.llmbridge.core.config.model.LlmBridgeConfig;
import io.llmbridge.core.model.RequestTimeout;
import io.llmbridge.core.model.Transport;
import io.llmbridge.core.provider.ProviderRegistry;
import io.llmbridge.core.retry.RetryOrchestrator;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "coherency", description = "Check that a model answers coherently on each provider serving it")
public final class CoherencyCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-m", "--model"}, required = true, description = "Model id to test")
    String model;

    @Option(names = {"-p", "--provider"}, defaultValue = "openrouter", description = "Provider name (default: ${DEFAULT-VALUE})")
    String provider;

    @Option(names = {"-w", "--workers"}, description = "Parallel workers (default from config)")
    Integer workers;

    @Option(names = "--force-subproviders", split = ",", description = "Only test these OpenRouter sub-providers")
    List<String> forcedSubProviders;

    @Option(names = "--prompts", description = "JSON file with [{id, prompt}] entries")
    String promptsFile;

    @Option(names = "--judge", description = "Ask a judge model to confirm each answer")
    boolean judge;

    @Option(names = "--stream", description = "Use streaming transport for target calls")
    boolean stream;

    @Option(names = "--timeout", description = "Per-request timeout in seconds")
    Double timeoutSeconds;

    @Option(names = {"-v", "--verbose"}, description = "Log every prompt result")
    boolean verbose;

    @ArgGroup(exclusive = false)
    ReasoningArgs reasoning;

    public CoherencyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LlmBridgeConfig config = context.loadConfig();
            CoherencySettings settings = config.coherency();
            ProviderRegistry registry = context.catalog(config).createRegistry();
            RetryOrchestrator orchestrator = context.orchestrator(config);

            RequestOverrides overrides = RequestOverrides.none()
                .withMaxRetries(settings.maxRetries())
                .withTimeout(RequestTimeout.ofSeconds(timeoutSeconds != null ? timeoutSeconds : settings.timeoutSeconds()));
            if (stream) {
                overrides = overrides.withTransport(Transport.STREAM);
            }
            if (reasoning != null) {
                overrides = overrides.withReasoning(reasoning.toOptions());
            }

            String suiteFile = promptsFile != null ? promptsFile : settings.promptsFile();
            PromptSuite suite = suiteFile == null || suiteFile.isBlank()
                ? PromptSuite.defaults()
                : PromptSuite.load(ConfigPaths.resolve(suiteFile), new ObjectMapper());

            ResponseJudge responseJudge = judge
                ? new LlmResponseJudge(orchestrator, registry.require(settings.judgeProvider()), settings.judgeModel())
                : null;

            CoherencyRun run = new CoherencyRun(
                model,
                provider,
                workers != null ? workers : settings.numWorkers(),
                overrides,
                verbose,
                forcedSubProviders,
                suite
            );
            CoherencyReport report = new CoherencyTester(registry, orchestrator, responseJudge).run(run);

            for (CoherencyResult result : report.results()) {
                System.out.println((result.passed() ? "PASS " : "FAIL ") + result.label());
                for (String failure : result.failures()) {
                    System.out.println("    " + failure);
                }
            }
            if (!report.failedProviders().isEmpty()) {
                System.out.println("Failed providers: " + String.join(", ", report.failedProviders()));
            }
            System.out.println("Overall: " + (report.success() ? "PASSED" : "FAILED"));
            return report.success() ? 0 : 1;
        } catch (Exception e) {
            System.err.println("Coherency command failed: " + e.getMessage());
            return 1;
        }
    }
}

package io.llmbridge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmbridge.core.config.model.LlmBridgeConfig;
import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.ChatMessage;
import io.llmbridge.core.model.LlmResponse;
import io.llmbridge.core.model.RequestTimeout;
import io.llmbridge.core.model.StandardizedResponse;
import io.llmbridge.core.model.Transport;
import io.llmbridge.core.provider.LlmProvider;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send one prompt to a provider and print the answer")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-p", "--provider"}, defaultValue = "openrouter", description = "Provider name (default: ${DEFAULT-VALUE})")
    String provider;

    @Option(names = {"-m", "--model"}, required = true, description = "Model id")
    String model;

    @Option(names = {"-s", "--system"}, description = "System message")
    String system;

    @Option(names = "--stream", description = "Use streaming transport")
    boolean stream;

    @Option(names = "--max-tokens", description = "Maximum completion tokens")
    Integer maxTokens;

    @Option(names = "--max-retries", description = "Retries after the first attempt")
    Integer maxRetries;

    @Option(names = "--timeout", description = "Read timeout in seconds")
    Double timeoutSeconds;

    @Option(names = "--allow", split = ",", description = "Sub-providers to route to, in order")
    List<String> allowList;

    @Option(names = "--ignore", split = ",", description = "Sub-providers to avoid")
    List<String> ignoreList;

    @Option(names = "--json", description = "Print the standardized response as JSON")
    boolean json;

    @ArgGroup(exclusive = false)
    ReasoningArgs reasoning;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LlmBridgeConfig config = context.loadConfig();
            LlmProvider target = context.catalog(config).createRegistry().require(provider);

            List<ChatMessage> messages = new ArrayList<>();
            if (system != null && !system.isBlank()) {
                messages.add(ChatMessage.system(system));
            }
            messages.add(ChatMessage.user(prompt));

            CanonicalRequest request = CanonicalRequest.of(model, messages)
                .withTransport(stream ? Transport.STREAM : Transport.DEFAULT)
                .withMaxTokens(maxTokens)
                .withMaxRetries(maxRetries)
                .withAllowList(allowList)
                .withIgnoreList(ignoreList);
            if (timeoutSeconds != null) {
                request = request.withTimeout(RequestTimeout.ofSeconds(timeoutSeconds));
            }
            if (reasoning != null) {
                request = request.withReasoning(reasoning.toOptions());
            }

            LlmResponse response = context.orchestrator(config).execute(target, request);
            if (!response.success()) {
                System.err.println("Request failed (" + response.errorInfo().type() + "): " + response.errorInfo().message());
                return 1;
            }

            StandardizedResponse answer = response.standardizedResponse();
            if (json) {
                System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(answer));
            } else {
                System.out.println(answer.content());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}

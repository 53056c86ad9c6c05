package io.llmbridge.core.coherency;

import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.LlmResponse;
import io.llmbridge.core.model.RequestTimeout;
import io.llmbridge.core.provider.LlmProvider;
import io.llmbridge.core.retry.CancellationToken;
import io.llmbridge.core.retry.RetryOrchestrator;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks a judge model whether an answer is on-topic and sensible. Only an exact {@code YES} passes.
 */
public final class LlmResponseJudge implements ResponseJudge {
    public static final String DEFAULT_PROVIDER = "openai";
    public static final String DEFAULT_MODEL = "gpt-4o-2024-08-06";
    public static final int JUDGE_MAX_RETRIES = 3;
    public static final RequestTimeout JUDGE_TIMEOUT = RequestTimeout.ofSeconds(60);

    private static final Logger LOG = LoggerFactory.getLogger(LlmResponseJudge.class);
    private static final String TEMPLATE = """
        You are an AI assistant evaluating whether another AI's response is coherent and sensible given the user's request.

        User Request:
        \"\"\"
        %s
        \"\"\"

        AI Response:
        \"\"\"
        %s
        \"\"\"

        Is the AI Response above a coherent and sensible answer to the User Request?
        Consider if the response is on-topic, understandable, and not complete gibberish or a clear error/failure message.

        Answer ONLY with 'YES' or 'NO'. Do not provide any explanation.
        """;

    private final RetryOrchestrator orchestrator;
    private final LlmProvider judgeProvider;
    private final String judgeModel;

    public LlmResponseJudge(RetryOrchestrator orchestrator, LlmProvider judgeProvider, String judgeModel) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.judgeProvider = Objects.requireNonNull(judgeProvider, "judgeProvider must not be null");
        this.judgeModel = Objects.requireNonNull(judgeModel, "judgeModel must not be null");
    }

    static String judgePrompt(String prompt, String answer) {
        return String.format(TEMPLATE, prompt, answer);
    }

    @Override
    public String judge(String prompt, String answer, CancellationToken token) {
        CanonicalRequest request = CanonicalRequest.ofPrompt(judgeModel, judgePrompt(prompt, answer))
            .withMaxRetries(JUDGE_MAX_RETRIES)
            .withTimeout(JUDGE_TIMEOUT);
        LlmResponse response = orchestrator.execute(judgeProvider, request, token);
        if (!response.success()) {
            return "judge request failed: " + response.errorInfo().message();
        }
        String verdict = response.standardizedResponse().content().trim().toUpperCase(Locale.ROOT);
        if ("YES".equals(verdict)) {
            return null;
        }
        if (!"NO".equals(verdict)) {
            LOG.warn("Judge returned unexpected verdict '{}'; treating as incoherent", verdict);
        }
        return "judged incoherent (" + verdict + ")";
    }
}

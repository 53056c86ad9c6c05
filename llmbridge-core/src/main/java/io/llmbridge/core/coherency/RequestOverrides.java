package io.llmbridge.core.coherency;

import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.ReasoningOptions;
import io.llmbridge.core.model.RequestTimeout;
import io.llmbridge.core.model.Transport;

/**
 * Options layered over every request a coherency run sends to its target. Null fields keep the
 * run's defaults: 90 second timeout, four retries, non-streamed transport.
 */
public record RequestOverrides(
    ReasoningOptions reasoning,
    RequestTimeout timeout,
    Integer maxRetries,
    Transport transport,
    Integer maxTokens
) {
    public static final RequestTimeout DEFAULT_TIMEOUT = RequestTimeout.ofSeconds(90);
    public static final int DEFAULT_MAX_RETRIES = 4;

    public static RequestOverrides none() {
        return new RequestOverrides(null, null, null, null, null);
    }

    public RequestOverrides withReasoning(ReasoningOptions value) {
        return new RequestOverrides(value, timeout, maxRetries, transport, maxTokens);
    }

    public RequestOverrides withTimeout(RequestTimeout value) {
        return new RequestOverrides(reasoning, value, maxRetries, transport, maxTokens);
    }

    public RequestOverrides withMaxRetries(Integer value) {
        return new RequestOverrides(reasoning, timeout, value, transport, maxTokens);
    }

    public RequestOverrides withTransport(Transport value) {
        return new RequestOverrides(reasoning, timeout, maxRetries, value, maxTokens);
    }

    public RequestOverrides withMaxTokens(Integer value) {
        return new RequestOverrides(reasoning, timeout, maxRetries, transport, value);
    }

    public CanonicalRequest apply(CanonicalRequest request) {
        CanonicalRequest applied = request
            .withTimeout(timeout == null ? DEFAULT_TIMEOUT : timeout)
            .withMaxRetries(maxRetries == null ? DEFAULT_MAX_RETRIES : maxRetries);
        if (transport != null) {
            applied = applied.withTransport(transport);
        }
        if (reasoning != null) {
            applied = applied.withReasoning(reasoning);
        }
        if (maxTokens != null) {
            applied = applied.withMaxTokens(maxTokens);
        }
        return applied;
    }
}

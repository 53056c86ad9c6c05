package io.llmbridge.core.provider;

import io.llmbridge.core.error.ProviderException;
import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.retry.CancellationToken;

/**
 * One attempt against one upstream API. Adapters never retry; that is left to
 * {@link io.llmbridge.core.retry.RetryOrchestrator}. Implementations must be safe for concurrent
 * use.
 */
public interface LlmProvider {
    String name();

    boolean supportsStreaming();

    default boolean supportsRouting() {
        return false;
    }

    ProviderReply execute(CanonicalRequest request, CancellationToken token) throws ProviderException;
}

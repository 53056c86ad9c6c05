package io.llmbridge.core.error;

import io.llmbridge.core.model.CanonicalRequest;
import java.util.Optional;

/**
 * Local contract checks that must pass before any network call. A violation is never retried.
 */
public final class RequestValidator {

    private RequestValidator() {
    }

    public static Optional<ProviderFailure> validate(CanonicalRequest request, boolean supportsStreaming, boolean supportsRouting) {
        if (request.requestsRawStreaming() && !request.streaming()) {
            return violation("Direct stream=true is not supported. Use transport='stream' to enable streaming transport with aggregated output.");
        }
        if (!request.allowList().isEmpty() && !request.ignoreList().isEmpty()) {
            return violation("allow_list and ignore_list are mutually exclusive");
        }
        if (request.reasoning() != null && request.reasoning().hasBudgetAndEffort()) {
            return violation("reasoning.max_tokens and reasoning.effort are mutually exclusive");
        }
        if (request.streaming() && !supportsStreaming) {
            return violation("transport='stream' is not supported by this provider");
        }
        if (!supportsRouting && (!request.allowList().isEmpty() || !request.ignoreList().isEmpty())) {
            return violation("allow_list/ignore_list are only supported by routing providers such as openrouter");
        }
        if (request.maxRetries() != null && request.maxRetries() < 0) {
            return violation("max_retries must be >= 0");
        }
        if (request.timeout() != null && !request.timeout().isValid()) {
            return violation("timeout values must be positive");
        }
        if (request.maxTokens() != null && request.maxTokens() <= 0) {
            return violation("max_tokens must be positive");
        }
        if (request.modelId().isBlank()) {
            return violation("model_id is required");
        }
        if (request.messages().isEmpty()) {
            return violation("messages must not be empty");
        }
        return Optional.empty();
    }

    private static Optional<ProviderFailure> violation(String message) {
        return Optional.of(ProviderFailure.contractViolation(message));
    }
}

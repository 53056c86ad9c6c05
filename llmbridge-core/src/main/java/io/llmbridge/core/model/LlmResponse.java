package io.llmbridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one logical call. Exactly one of {@code standardizedResponse} and {@code errorInfo}
 * is present, matching {@code success}.
 */
public record LlmResponse(
    boolean success,
    StandardizedResponse standardizedResponse,
    ErrorInfo errorInfo,
    JsonNode rawProviderResponse
) {

    public LlmResponse {
        if (success && (standardizedResponse == null || errorInfo != null)) {
            throw new IllegalArgumentException("successful response must carry a standardized response and no error");
        }
        if (!success && (errorInfo == null || standardizedResponse != null)) {
            throw new IllegalArgumentException("failed response must carry error info and no standardized response");
        }
    }

    public static LlmResponse success(StandardizedResponse response, JsonNode raw) {
        return new LlmResponse(true, response, null, raw);
    }

    public static LlmResponse failure(ErrorInfo errorInfo) {
        return new LlmResponse(false, null, errorInfo, null);
    }

    public static LlmResponse failure(ErrorInfo errorInfo, JsonNode raw) {
        return new LlmResponse(false, null, errorInfo, raw);
    }

    public boolean retryable() {
        return !success && errorInfo.retryable();
    }
}

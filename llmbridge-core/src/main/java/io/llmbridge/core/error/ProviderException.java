package io.llmbridge.core.error;

import com.fasterxml.jackson.databind.JsonNode;

public class ProviderException extends Exception {
    private final ProviderFailure failure;
    private final transient JsonNode rawResponse;

    public ProviderException(ProviderFailure failure) {
        this(failure, null, null);
    }

    public ProviderException(ProviderFailure failure, JsonNode rawResponse) {
        this(failure, rawResponse, null);
    }

    public ProviderException(ProviderFailure failure, JsonNode rawResponse, Throwable cause) {
        super(failure.message(), cause);
        this.failure = failure;
        this.rawResponse = rawResponse;
    }

    public ProviderFailure failure() {
        return failure;
    }

    public JsonNode rawResponse() {
        return rawResponse;
    }
}

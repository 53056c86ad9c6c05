package io.llmbridge.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.llmbridge.core.model.StandardizedResponse;
import java.util.Objects;

/**
 * Successful outcome of one adapter attempt: the normalized response plus the provider payload it
 * was built from (the last event for streamed calls).
 */
public record ProviderReply(StandardizedResponse response, JsonNode raw) {

    public ProviderReply {
        Objects.requireNonNull(response, "response must not be null");
    }
}

package io.llmbridge.core.provider;

import java.util.Objects;

public record ProviderDefinition(String name, String apiBase, String apiKeyEnv, ReasoningStyle reasoningStyle) {

    public ProviderDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(apiBase, "apiBase must not be null");
        apiKeyEnv = apiKeyEnv == null ? "" : apiKeyEnv;
        reasoningStyle = reasoningStyle == null ? ReasoningStyle.REASONING_OBJECT : reasoningStyle;
    }

    public ProviderDefinition withApiBase(String value) {
        return new ProviderDefinition(name, value, apiKeyEnv, reasoningStyle);
    }
}

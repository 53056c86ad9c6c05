package io.llmbridge.core.model;

import com.fasterxml.jackson.databind.JsonNode;

public record Usage(Integer promptTokens, Integer completionTokens, Integer totalTokens, Integer reasoningTokens) {

    public static Usage empty() {
        return new Usage(null, null, null, null);
    }

    /**
     * Reads an OpenAI-style {@code usage} object. Missing fields stay null.
     */
    public static Usage fromOpenAi(JsonNode usage) {
        if (usage == null || !usage.isObject()) {
            return empty();
        }
        return new Usage(
            intOrNull(usage.path("prompt_tokens")),
            intOrNull(usage.path("completion_tokens")),
            intOrNull(usage.path("total_tokens")),
            intOrNull(usage.path("completion_tokens_details").path("reasoning_tokens"))
        );
    }

    public boolean isEmpty() {
        return promptTokens == null && completionTokens == null && totalTokens == null && reasoningTokens == null;
    }

    public boolean hasReasoningTokens() {
        return reasoningTokens != null && reasoningTokens > 0;
    }

    static Integer intOrNull(JsonNode node) {
        return node != null && node.isNumber() ? node.intValue() : null;
    }
}

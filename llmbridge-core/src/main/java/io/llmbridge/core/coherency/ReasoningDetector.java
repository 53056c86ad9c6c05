package io.llmbridge.core.coherency;

import com.fasterxml.jackson.databind.JsonNode;
import io.llmbridge.core.model.LlmResponse;

/**
 * Decides whether a successful response shows any sign of reasoning: standardized reasoning text,
 * reasoning fields on the raw message or delta, or a positive reasoning token count.
 */
public final class ReasoningDetector {

    private ReasoningDetector() {
    }

    public static boolean hasReasoning(LlmResponse response) {
        if (response == null || !response.success()) {
            return false;
        }
        if (response.standardizedResponse().hasReasoning()
            || response.standardizedResponse().usage().hasReasoningTokens()) {
            return true;
        }
        JsonNode raw = response.rawProviderResponse();
        if (raw == null) {
            return false;
        }
        JsonNode choice = raw.path("choices").path(0);
        return present(choice.path("message")) || present(choice.path("delta"))
            || raw.path("usage").path("completion_tokens_details").path("reasoning_tokens").asInt(0) > 0;
    }

    private static boolean present(JsonNode message) {
        return nonEmpty(message.path("reasoning"))
            || nonEmpty(message.path("reasoning_content"))
            || nonEmpty(message.path("reasoning_details"));
    }

    private static boolean nonEmpty(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return false;
        }
        if (node.isTextual()) {
            return !node.asText().isBlank();
        }
        return !node.isContainerNode() || node.size() > 0;
    }
}

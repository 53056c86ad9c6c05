package io.llmbridge.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.llmbridge.core.model.StandardizedResponse;
import io.llmbridge.core.model.Usage;

/**
 * Maps a non-streamed {@code chat/completions} body onto {@link StandardizedResponse}. Missing
 * fields produce empty values, never an exception.
 */
public final class OpenAiResponseStandardizer {

    private OpenAiResponseStandardizer() {
    }

    public static StandardizedResponse standardize(JsonNode body, String provider) {
        JsonNode choice = body.path("choices").path(0);
        JsonNode message = choice.path("message");
        return new StandardizedResponse(
            textOrNull(body.path("id")),
            body.path("created").isNumber() ? body.path("created").longValue() : null,
            textOrNull(body.path("model")),
            provider,
            textOrNull(message.path("content")),
            textOrNull(choice.path("finish_reason")),
            Usage.fromOpenAi(body.path("usage")),
            reasoningOf(message),
            textOrNull(body.path("provider"))
        );
    }

    /**
     * True when the first choice was stopped by a content filter or carries an error object.
     */
    public static boolean contentFiltered(JsonNode body) {
        JsonNode choice = body.path("choices").path(0);
        if (choice.isMissingNode()) {
            return false;
        }
        return "content_filter".equals(choice.path("finish_reason").asText(""))
            || (choice.has("error") && !choice.path("error").isNull());
    }

    public static String filterMessage(JsonNode body) {
        JsonNode error = body.path("choices").path(0).path("error");
        if (error.isObject()) {
            return error.path("message").asText("Content filtered");
        }
        return "Content filtered (finish_reason=content_filter)";
    }

    static String reasoningOf(JsonNode message) {
        String reasoning = textOrNull(message.path("reasoning"));
        if (reasoning == null || reasoning.isBlank()) {
            reasoning = textOrNull(message.path("reasoning_content"));
        }
        if ((reasoning == null || reasoning.isBlank()) && message.path("reasoning_details").isArray()) {
            StringBuilder joined = new StringBuilder();
            for (JsonNode detail : message.path("reasoning_details")) {
                String text = textOrNull(detail.path("text"));
                if (text == null) {
                    text = textOrNull(detail.path("summary"));
                }
                if (text != null) {
                    joined.append(text);
                }
            }
            reasoning = joined.length() == 0 ? null : joined.toString();
        }
        return reasoning;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}

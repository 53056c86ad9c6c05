package io.llmbridge.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.llmbridge.core.model.StandardizedResponse;
import io.llmbridge.core.model.Usage;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps a Gemini {@code generateContent} body onto {@link StandardizedResponse}. Gemini reports no
 * id or timestamp; {@code modelVersion} stands in for the model.
 */
public final class GoogleResponseStandardizer {
    static final Set<String> FILTER_REASONS = Set.of("SAFETY", "RECITATION", "OTHER");

    private static final Map<String, String> FINISH_REASONS = Map.of(
        "STOP", "stop",
        "MAX_TOKENS", "length",
        "SAFETY", "content_filter",
        "RECITATION", "content_filter",
        "OTHER", "error",
        "UNSPECIFIED", "error",
        "FINISH_REASON_UNSPECIFIED", "error"
    );

    private GoogleResponseStandardizer() {
    }

    public static StandardizedResponse standardize(JsonNode body, String provider) {
        JsonNode candidate = body.path("candidates").path(0);
        StringBuilder content = new StringBuilder();
        StringBuilder thoughts = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (!part.path("text").isTextual()) {
                continue;
            }
            if (part.path("thought").asBoolean(false)) {
                thoughts.append(part.path("text").asText());
            } else {
                content.append(part.path("text").asText());
            }
        }

        JsonNode metadata = body.path("usageMetadata");
        Usage usage = metadata.isObject()
            ? new Usage(
                intOrNull(metadata.path("promptTokenCount")),
                intOrNull(metadata.path("candidatesTokenCount")),
                intOrNull(metadata.path("totalTokenCount")),
                intOrNull(metadata.path("thoughtsTokenCount")))
            : Usage.empty();

        return new StandardizedResponse(
            body.path("responseId").asText(null),
            null,
            body.path("modelVersion").asText(null),
            provider,
            content.toString(),
            finishReason(candidate.path("finishReason").asText(null)),
            usage,
            thoughts.length() == 0 ? null : thoughts.toString(),
            null
        );
    }

    public static String finishReason(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        return FINISH_REASONS.getOrDefault(raw, raw.toLowerCase(Locale.ROOT));
    }

    private static Integer intOrNull(JsonNode node) {
        return node.isNumber() ? node.intValue() : null;
    }
}

package io.llmbridge.core.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmbridge.core.error.ErrorClassifier;
import io.llmbridge.core.error.FailureKind;
import io.llmbridge.core.error.ProviderException;
import io.llmbridge.core.error.ProviderFailure;
import io.llmbridge.core.model.StandardizedResponse;
import io.llmbridge.core.model.Usage;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds OpenAI-style chat completion chunks into one {@link StandardizedResponse}. Content deltas
 * are concatenated in arrival order. A stream counts as complete after {@code [DONE]}, or when it
 * closes after some chunk reported a finish reason.
 *
 * <p>Not thread-safe; one aggregator per stream.
 */
public final class StreamAggregator {
    public static final String DONE = "[DONE]";
    private static final Logger LOG = LoggerFactory.getLogger(StreamAggregator.class);

    private final String provider;
    private final ObjectMapper mapper;
    private final StringBuilder content = new StringBuilder();
    private final StringBuilder reasoning = new StringBuilder();
    private String id;
    private Long created;
    private String model;
    private String subProvider;
    private String finishReason;
    private Usage usage = Usage.empty();
    private JsonNode lastEvent;
    private boolean done;

    public StreamAggregator(String provider, ObjectMapper mapper) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
    }

    /**
     * @return true once the terminator has been seen and no further events should be read
     */
    public boolean accept(String data) throws ProviderException {
        if (data == null) {
            return done;
        }
        String trimmed = data.trim();
        if (trimmed.isEmpty()) {
            return done;
        }
        if (DONE.equals(trimmed)) {
            done = true;
            return true;
        }
        JsonNode event;
        try {
            event = mapper.readTree(trimmed);
        } catch (IOException e) {
            LOG.debug("Skipping unparseable stream chunk from {}: {}", provider, e.getMessage());
            return false;
        }
        accept(event);
        return false;
    }

    public void accept(JsonNode event) throws ProviderException {
        if (event == null || !event.isObject()) {
            return;
        }
        lastEvent = event;
        JsonNode error = event.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ProviderException(new ProviderFailure(
                FailureKind.BODY_ERROR,
                ErrorClassifier.statusCodeOf(error),
                "Stream error from " + provider + ": " + messageOf(error)
            ), event);
        }

        if (event.hasNonNull("id")) {
            id = event.path("id").asText();
        }
        if (event.path("created").isNumber()) {
            created = event.path("created").longValue();
        }
        if (event.hasNonNull("model")) {
            model = event.path("model").asText();
        }
        if (event.path("provider").isTextual()) {
            subProvider = event.path("provider").asText();
        }
        if (event.path("usage").isObject()) {
            usage = Usage.fromOpenAi(event.path("usage"));
        }

        JsonNode choice = event.path("choices").path(0);
        if (choice.isMissingNode()) {
            return;
        }
        JsonNode choiceError = choice.path("error");
        if (!choiceError.isMissingNode() && !choiceError.isNull()) {
            throw new ProviderException(ProviderFailure.of(
                FailureKind.CONTENT_FILTER,
                "Content filtered by " + provider + ": " + messageOf(choiceError)
            ), event);
        }
        String reason = choice.path("finish_reason").asText("");
        if (!reason.isEmpty() && !"null".equals(reason)) {
            finishReason = reason;
            if ("content_filter".equals(reason)) {
                throw new ProviderException(ProviderFailure.of(
                    FailureKind.CONTENT_FILTER,
                    "Stream stopped by content filter (finish_reason=content_filter)"
                ), event);
            }
        }

        JsonNode delta = choice.path("delta");
        JsonNode piece = delta.path("content");
        if (piece.isTextual()) {
            content.append(piece.asText());
        } else if (choice.path("message").path("content").isTextual()) {
            content.append(choice.path("message").path("content").asText());
        }
        JsonNode thought = delta.hasNonNull("reasoning") ? delta.path("reasoning") : delta.path("reasoning_content");
        if (thought.isTextual()) {
            reasoning.append(thought.asText());
        }
    }

    public boolean isDone() {
        return done;
    }

    public boolean complete() {
        return done || finishReason != null;
    }

    public JsonNode lastEvent() {
        return lastEvent;
    }

    public StandardizedResponse finish() throws ProviderException {
        if (!complete()) {
            throw new ProviderException(ProviderFailure.of(
                FailureKind.STREAM_INCOMPLETE,
                "Stream from " + provider + " closed before completion"
            ), lastEvent);
        }
        if (content.length() == 0 && reasoning.length() == 0) {
            throw new ProviderException(ProviderFailure.of(
                FailureKind.CONTENT_FILTER,
                "Stream from " + provider + " completed with no content"
            ), lastEvent);
        }
        return new StandardizedResponse(
            id,
            created,
            model,
            provider,
            content.toString(),
            finishReason == null ? "stop" : finishReason,
            usage,
            reasoning.length() == 0 ? null : reasoning.toString(),
            subProvider
        );
    }

    private static String messageOf(JsonNode error) {
        if (error.isTextual()) {
            return error.asText();
        }
        if (error.hasNonNull("message")) {
            return error.path("message").asText();
        }
        return error.toString();
    }
}

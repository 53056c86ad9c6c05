package io.llmbridge.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmbridge.core.credential.CredentialResolver;
import io.llmbridge.core.error.ErrorClassifier;
import io.llmbridge.core.error.FailureKind;
import io.llmbridge.core.error.ProviderException;
import io.llmbridge.core.error.ProviderFailure;
import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.ChatMessage;
import io.llmbridge.core.model.MessageRole;
import io.llmbridge.core.model.ReasoningOptions;
import io.llmbridge.core.model.RequestTimeout;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Gemini {@code generateContent} adapter. Non-streaming only; system messages are sent as user
 * turns and safety thresholds are relaxed to {@code BLOCK_NONE}.
 */
public final class GoogleProvider extends AbstractHttpLlmProvider {
    private static final List<String> HARM_CATEGORIES = List.of(
        "HARM_CATEGORY_HARASSMENT",
        "HARM_CATEGORY_HATE_SPEECH",
        "HARM_CATEGORY_SEXUALLY_EXPLICIT",
        "HARM_CATEGORY_DANGEROUS_CONTENT"
    );

    public GoogleProvider(
        ProviderDefinition definition,
        CredentialResolver credentials,
        OkHttpClient client,
        ObjectMapper mapper,
        Map<String, String> extraHeaders
    ) {
        super(definition, credentials, client, mapper, extraHeaders);
    }

    public GoogleProvider(
        ProviderDefinition definition,
        CredentialResolver credentials,
        OkHttpClient client,
        ObjectMapper mapper,
        Map<String, String> extraHeaders,
        RequestTimeout defaultTimeout
    ) {
        super(definition, credentials, client, mapper, extraHeaders, defaultTimeout);
    }

    @Override
    public boolean supportsStreaming() {
        return false;
    }

    @Override
    protected Request.Builder buildRequest(CanonicalRequest request, String apiKey) throws ProviderException {
        String json;
        try {
            json = mapper.writeValueAsString(buildPayload(request));
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderFailure.of(FailureKind.OTHER, "Cannot serialize request: " + e.getOriginalMessage()), null, e);
        }
        String model = request.modelId().startsWith("models/") ? request.modelId().substring(7) : request.modelId();
        HttpUrl url = apiBase().newBuilder()
            .addPathSegment("models")
            .addPathSegment(model + ":generateContent")
            .addQueryParameter("key", apiKey)
            .build();
        return new Request.Builder()
            .url(url)
            .post(RequestBody.create(json, JSON))
            .header("Content-Type", "application/json");
    }

    Map<String, Object> buildPayload(CanonicalRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("contents", toContents(request.messages()));
        List<Map<String, Object>> safety = new ArrayList<>();
        for (String category : HARM_CATEGORIES) {
            safety.add(Map.of("category", category, "threshold", "BLOCK_NONE"));
        }
        payload.put("safetySettings", safety);

        Map<String, Object> generation = new LinkedHashMap<>();
        if (request.maxTokens() != null) {
            generation.put("maxOutputTokens", request.maxTokens());
        }
        Map<String, Object> thinking = thinkingConfig(request.reasoning());
        if (!thinking.isEmpty()) {
            generation.put("thinkingConfig", thinking);
        }
        if (!generation.isEmpty()) {
            payload.put("generationConfig", generation);
        }
        for (Map.Entry<String, Object> option : request.extraOptions().entrySet()) {
            payload.putIfAbsent(option.getKey(), option.getValue());
        }
        return payload;
    }

    @Override
    protected ProviderReply parseReply(JsonNode body) throws ProviderException {
        String blockReason = body.path("promptFeedback").path("blockReason").asText("");
        if (!blockReason.isEmpty()) {
            throw new ProviderException(
                ProviderFailure.of(FailureKind.CONTENT_FILTER, "Prompt blocked due to: " + blockReason),
                body
            );
        }
        String finish = body.path("candidates").path(0).path("finishReason").asText("");
        if (GoogleResponseStandardizer.FILTER_REASONS.contains(finish)) {
            throw new ProviderException(
                ProviderFailure.of(FailureKind.CONTENT_FILTER, "Response stopped due to: " + finish),
                body
            );
        }
        JsonNode error = body.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new ProviderException(
                new ProviderFailure(FailureKind.BODY_ERROR, ErrorClassifier.statusCodeOf(error), error.path("message").asText("Unknown Google API error")),
                body
            );
        }
        return new ProviderReply(GoogleResponseStandardizer.standardize(body, name()), body);
    }

    private static List<Map<String, Object>> toContents(List<ChatMessage> messages) {
        if (messages.size() == 1 && messages.get(0).role() == MessageRole.USER) {
            return List.of(Map.of("parts", List.of(Map.of("text", messages.get(0).content()))));
        }
        List<Map<String, Object>> contents = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.content().isEmpty()) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role() == MessageRole.ASSISTANT ? "model" : "user");
            row.put("parts", List.of(Map.of("text", message.content())));
            contents.add(row);
        }
        return contents;
    }

    private static Map<String, Object> thinkingConfig(ReasoningOptions reasoning) {
        Map<String, Object> thinking = new LinkedHashMap<>();
        if (reasoning == null) {
            return thinking;
        }
        if (!reasoning.enabled()) {
            thinking.put("thinkingBudget", 0);
            return thinking;
        }
        if (reasoning.maxTokens() != null) {
            thinking.put("thinkingBudget", reasoning.maxTokens());
        } else if (reasoning.effort() != null) {
            thinking.put("thinkingBudget", switch (reasoning.effort()) {
                case LOW -> 1024;
                case MEDIUM -> 8192;
                case HIGH -> 24576;
            });
        } else {
            thinking.put("thinkingBudget", -1);
        }
        thinking.put("includeThoughts", true);
        return thinking;
    }
}

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
import io.llmbridge.core.model.ReasoningOptions;
import io.llmbridge.core.model.RequestTimeout;
import io.llmbridge.core.stream.SseEventReader;
import io.llmbridge.core.stream.StreamAggregator;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okio.BufferedSource;

/**
 * Adapter for any endpoint speaking the OpenAI {@code chat/completions} dialect: OpenAI itself,
 * Fireworks, Chutes, xAI, Moonshot and TNG Tech.
 */
public class OpenAiCompatProvider extends AbstractHttpLlmProvider {

    public OpenAiCompatProvider(
        ProviderDefinition definition,
        CredentialResolver credentials,
        OkHttpClient client,
        ObjectMapper mapper,
        Map<String, String> extraHeaders
    ) {
        super(definition, credentials, client, mapper, extraHeaders);
    }

    public OpenAiCompatProvider(
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
        return true;
    }

    @Override
    protected Request.Builder buildRequest(CanonicalRequest request, String apiKey) throws ProviderException {
        Map<String, Object> payload = buildPayload(request);
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ProviderException(ProviderFailure.of(FailureKind.OTHER, "Cannot serialize request: " + e.getOriginalMessage()), null, e);
        }

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(RequestBody.create(json, JSON))
            .header("Authorization", "Bearer " + apiKey)
            .header("Content-Type", "application/json");
        if (request.streaming()) {
            builder.header("Accept", "text/event-stream");
        }
        return builder;
    }

    protected Map<String, Object> buildPayload(CanonicalRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", request.modelId());
        payload.put("messages", toWireMessages(request.messages()));
        payload.put("max_tokens", request.effectiveMaxTokens());
        applyReasoning(payload, request.reasoning());
        for (Map.Entry<String, Object> option : request.extraOptions().entrySet()) {
            if (!"stream".equals(option.getKey())) {
                payload.putIfAbsent(option.getKey(), option.getValue());
            }
        }
        if (request.streaming()) {
            payload.put("stream", true);
        }
        return payload;
    }

    protected void applyReasoning(Map<String, Object> payload, ReasoningOptions reasoning) {
        if (reasoning == null) {
            return;
        }
        if (definition().reasoningStyle() == ReasoningStyle.REASONING_EFFORT) {
            if (reasoning.enabled() && reasoning.effort() != null) {
                payload.put("reasoning_effort", reasoning.effort().wireValue());
            }
            return;
        }
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("enabled", reasoning.enabled());
        if (reasoning.maxTokens() != null) {
            wire.put("max_tokens", reasoning.maxTokens());
        }
        if (reasoning.effort() != null) {
            wire.put("effort", reasoning.effort().wireValue());
        }
        payload.put("reasoning", wire);
    }

    @Override
    protected ProviderReply parseReply(JsonNode body) throws ProviderException {
        if (body.has("error") && !body.has("choices")) {
            JsonNode error = body.path("error");
            throw new ProviderException(
                new ProviderFailure(FailureKind.BODY_ERROR, ErrorClassifier.statusCodeOf(error), extractErrorMessage(body, error.toString())),
                body
            );
        }
        if (OpenAiResponseStandardizer.contentFiltered(body)) {
            throw new ProviderException(
                ProviderFailure.of(FailureKind.CONTENT_FILTER, OpenAiResponseStandardizer.filterMessage(body)),
                body
            );
        }
        return new ProviderReply(OpenAiResponseStandardizer.standardize(body, name()), body);
    }

    @Override
    protected ProviderReply parseStream(BufferedSource source) throws IOException, ProviderException {
        StreamAggregator aggregator = new StreamAggregator(name(), mapper);
        SseEventReader reader = new SseEventReader(source);
        String data;
        while ((data = reader.next()) != null) {
            if (aggregator.accept(data)) {
                break;
            }
        }
        return new ProviderReply(aggregator.finish(), aggregator.lastEvent());
    }

    private HttpUrl completionsUrl() {
        return apiBase().newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private static List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().wireValue());
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }
}

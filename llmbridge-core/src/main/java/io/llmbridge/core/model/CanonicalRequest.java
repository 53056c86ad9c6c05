package io.llmbridge.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Provider-neutral chat completion request. Instances are immutable; the {@code with*} methods
 * return copies so a request that has been dispatched is never changed underneath an attempt.
 *
 * <p>Nullable fields ({@code timeout}, {@code maxRetries}, {@code reasoning}, {@code maxTokens})
 * mean "use the provider or orchestrator default".
 */
public record CanonicalRequest(
    List<ChatMessage> messages,
    String modelId,
    RequestTimeout timeout,
    Integer maxRetries,
    List<String> allowList,
    List<String> ignoreList,
    Transport transport,
    ReasoningOptions reasoning,
    Integer maxTokens,
    boolean rawStreamFlag,
    Map<String, Object> extraOptions
) {
    public static final int DEFAULT_MAX_TOKENS = 4096;

    public CanonicalRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        modelId = modelId == null ? "" : modelId;
        allowList = distinct(allowList);
        ignoreList = distinct(ignoreList);
        transport = transport == null ? Transport.DEFAULT : transport;
        extraOptions = extraOptions == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extraOptions));
    }

    public static CanonicalRequest of(String modelId, List<ChatMessage> messages) {
        Objects.requireNonNull(modelId, "modelId must not be null");
        return new CanonicalRequest(messages, modelId, null, null, null, null, Transport.DEFAULT, null, null, false, null);
    }

    public static CanonicalRequest ofPrompt(String modelId, String prompt) {
        return of(modelId, List.of(ChatMessage.user(prompt)));
    }

    public CanonicalRequest withTimeout(RequestTimeout value) {
        return new CanonicalRequest(messages, modelId, value, maxRetries, allowList, ignoreList, transport, reasoning, maxTokens, rawStreamFlag, extraOptions);
    }

    public CanonicalRequest withMaxRetries(Integer value) {
        return new CanonicalRequest(messages, modelId, timeout, value, allowList, ignoreList, transport, reasoning, maxTokens, rawStreamFlag, extraOptions);
    }

    public CanonicalRequest withAllowList(List<String> value) {
        return new CanonicalRequest(messages, modelId, timeout, maxRetries, value, ignoreList, transport, reasoning, maxTokens, rawStreamFlag, extraOptions);
    }

    public CanonicalRequest withIgnoreList(List<String> value) {
        return new CanonicalRequest(messages, modelId, timeout, maxRetries, allowList, value, transport, reasoning, maxTokens, rawStreamFlag, extraOptions);
    }

    public CanonicalRequest withTransport(Transport value) {
        return new CanonicalRequest(messages, modelId, timeout, maxRetries, allowList, ignoreList, value, reasoning, maxTokens, rawStreamFlag, extraOptions);
    }

    public CanonicalRequest withReasoning(ReasoningOptions value) {
        return new CanonicalRequest(messages, modelId, timeout, maxRetries, allowList, ignoreList, transport, value, maxTokens, rawStreamFlag, extraOptions);
    }

    public CanonicalRequest withMaxTokens(Integer value) {
        return new CanonicalRequest(messages, modelId, timeout, maxRetries, allowList, ignoreList, transport, reasoning, value, rawStreamFlag, extraOptions);
    }

    public CanonicalRequest withRawStreamFlag(boolean value) {
        return new CanonicalRequest(messages, modelId, timeout, maxRetries, allowList, ignoreList, transport, reasoning, maxTokens, value, extraOptions);
    }

    public CanonicalRequest withOption(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(extraOptions);
        merged.put(key, value);
        return new CanonicalRequest(messages, modelId, timeout, maxRetries, allowList, ignoreList, transport, reasoning, maxTokens, rawStreamFlag, merged);
    }

    public int effectiveMaxTokens() {
        return maxTokens == null ? DEFAULT_MAX_TOKENS : maxTokens;
    }

    public boolean streaming() {
        return transport == Transport.STREAM;
    }

    /**
     * True when the caller asked for provider-level streaming directly, either through the flag or
     * by smuggling {@code stream} into the pass-through options.
     */
    public boolean requestsRawStreaming() {
        if (rawStreamFlag) {
            return true;
        }
        Object stream = extraOptions.get("stream");
        if (stream instanceof Boolean flag) {
            return flag;
        }
        return stream != null && "true".equalsIgnoreCase(String.valueOf(stream));
    }

    private static List<String> distinct(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                unique.add(value.trim());
            }
        }
        return List.copyOf(new ArrayList<>(unique));
    }
}

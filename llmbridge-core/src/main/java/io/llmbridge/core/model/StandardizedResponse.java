package io.llmbridge.core.model;

import java.util.Objects;

/**
 * Canonical completion result. {@code id}, {@code created}, {@code reasoning} and
 * {@code subProvider} are absent for providers that do not report them.
 */
public record StandardizedResponse(
    String id,
    Long created,
    String model,
    String provider,
    String content,
    String finishReason,
    Usage usage,
    String reasoning,
    String subProvider
) {

    public StandardizedResponse {
        id = id == null ? "" : id;
        model = model == null ? "" : model;
        provider = Objects.requireNonNull(provider, "provider must not be null");
        content = content == null ? "" : content;
        finishReason = finishReason == null ? "" : finishReason;
        usage = usage == null ? Usage.empty() : usage;
    }

    public boolean hasReasoning() {
        return reasoning != null && !reasoning.isBlank();
    }
}

package io.llmbridge.core.provider;

/**
 * How an OpenAI-compatible endpoint expects the reasoning override on the wire.
 */
public enum ReasoningStyle {
    /** {@code "reasoning": {"enabled": .., "max_tokens"|"effort": ..}} */
    REASONING_OBJECT,
    /** {@code "reasoning_effort": "low"|"medium"|"high"} */
    REASONING_EFFORT
}

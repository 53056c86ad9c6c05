package io.llmbridge.core.model;

/**
 * Per-request reasoning ("thinking") override. {@code maxTokens} and {@code effort} are mutually
 * exclusive; the combination is rejected before dispatch rather than here, so that callers get a
 * structured {@code invalid_option} response instead of an exception.
 */
public record ReasoningOptions(boolean enabled, Integer maxTokens, ReasoningEffort effort) {

    public static ReasoningOptions on() {
        return new ReasoningOptions(true, null, null);
    }

    public static ReasoningOptions off() {
        return new ReasoningOptions(false, null, null);
    }

    public static ReasoningOptions withBudget(int maxTokens) {
        return new ReasoningOptions(true, maxTokens, null);
    }

    public static ReasoningOptions withEffort(ReasoningEffort effort) {
        return new ReasoningOptions(true, null, effort);
    }

    public boolean hasBudgetAndEffort() {
        return maxTokens != null && effort != null;
    }
}

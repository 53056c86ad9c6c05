package io.llmbridge.core.model;

import java.util.Locale;

public enum ReasoningEffort {
    LOW,
    MEDIUM,
    HIGH;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

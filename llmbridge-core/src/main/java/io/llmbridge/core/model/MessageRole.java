package io.llmbridge.core.model;

import java.util.Locale;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageRole fromWire(String value) {
        if (value == null || value.isBlank()) {
            return USER;
        }
        return MessageRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

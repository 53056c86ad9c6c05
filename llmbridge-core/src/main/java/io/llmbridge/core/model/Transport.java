package io.llmbridge.core.model;

import java.util.Locale;

public enum Transport {
    DEFAULT,
    STREAM;

    public static Transport fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        return Transport.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

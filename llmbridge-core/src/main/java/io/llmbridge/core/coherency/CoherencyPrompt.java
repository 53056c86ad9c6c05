package io.llmbridge.core.coherency;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoherencyPrompt(String id, String prompt) {

    public CoherencyPrompt {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
    }
}

package io.llmbridge.core.coherency;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public record PromptSuite(List<CoherencyPrompt> prompts) {
    private static final List<CoherencyPrompt> DEFAULT_PROMPTS = List.of(
        new CoherencyPrompt("test_dog", "Write a story about a dog who is scared of cats."),
        new CoherencyPrompt("test_godzilla", "Write a humorous news article about Godzilla visiting New York on holiday."),
        new CoherencyPrompt("test_dvorak", "Write an argument in favor of teaching Dvorak keyboards in school."),
        new CoherencyPrompt("test_os", "Compare and contrast the different major operating systems available for PCs.")
    );

    public PromptSuite {
        Objects.requireNonNull(prompts, "prompts must not be null");
        if (prompts.isEmpty()) {
            throw new IllegalArgumentException("prompt suite must contain at least one prompt");
        }
        prompts = List.copyOf(prompts);
    }

    public static PromptSuite defaults() {
        return new PromptSuite(DEFAULT_PROMPTS);
    }

    /**
     * Reads a JSON array of {@code {"id": ..., "prompt": ...}} objects.
     */
    public static PromptSuite load(Path file, ObjectMapper mapper) throws IOException {
        List<CoherencyPrompt> prompts = mapper.readValue(
            Files.readString(file),
            new TypeReference<List<CoherencyPrompt>>() {
            }
        );
        return new PromptSuite(prompts);
    }

    public int size() {
        return prompts.size();
    }
}

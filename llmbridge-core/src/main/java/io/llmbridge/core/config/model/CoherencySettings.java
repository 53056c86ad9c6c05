package io.llmbridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CoherencySettings(
    @JsonAlias({"num_workers"}) int numWorkers,
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"timeout_seconds"}) double timeoutSeconds,
    @JsonAlias({"prompts_file"}) String promptsFile,
    @JsonAlias({"judge_provider"}) String judgeProvider,
    @JsonAlias({"judge_model"}) String judgeModel
) {

    public static CoherencySettings defaults() {
        return new CoherencySettings(4, 4, 90, "", "openai", "gpt-4o-2024-08-06");
    }

    public boolean hasPromptsFile() {
        return promptsFile != null && !promptsFile.isBlank();
    }
}

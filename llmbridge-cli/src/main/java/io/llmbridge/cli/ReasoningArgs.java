package io.llmbridge.cli;

import io.llmbridge.core.model.ReasoningEffort;
import io.llmbridge.core.model.ReasoningOptions;
import java.util.Locale;
import picocli.CommandLine.Option;

/**
 * Reasoning flags shared by {@code chat} and {@code coherency}.
 */
final class ReasoningArgs {

    @Option(names = "--reasoning", description = "Request reasoning: on or off")
    String mode;

    @Option(names = "--reasoning-effort", description = "Reasoning effort: low, medium or high")
    String effort;

    @Option(names = "--reasoning-max-tokens", description = "Reasoning token budget")
    Integer maxTokens;

    ReasoningOptions toOptions() {
        if (mode == null && effort == null && maxTokens == null) {
            return null;
        }
        boolean enabled = mode == null || !"off".equalsIgnoreCase(mode.trim());
        ReasoningEffort parsedEffort = effort == null ? null : ReasoningEffort.valueOf(effort.trim().toUpperCase(Locale.ROOT));
        return new ReasoningOptions(enabled, maxTokens, parsedEffort);
    }
}

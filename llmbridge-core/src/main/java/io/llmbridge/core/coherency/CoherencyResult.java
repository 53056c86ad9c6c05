package io.llmbridge.core.coherency;

import java.util.List;
import java.util.Objects;

/**
 * Outcome for one target: the provider itself, or one sub-provider behind a gateway.
 */
public record CoherencyResult(String providerName, String subProviderName, boolean passed, List<String> failures) {

    public CoherencyResult {
        Objects.requireNonNull(providerName, "providerName must not be null");
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public String label() {
        return subProviderName == null ? providerName : providerName + "/" + subProviderName;
    }
}

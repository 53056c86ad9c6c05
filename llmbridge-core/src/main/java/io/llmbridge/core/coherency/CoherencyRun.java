package io.llmbridge.core.coherency;

import java.util.List;
import java.util.Objects;

/**
 * One coherency run. {@code allowedSubProviders} forces the sub-providers to test and is only
 * meaningful for routing gateways.
 */
public record CoherencyRun(
    String targetModelId,
    String targetProviderName,
    int numWorkers,
    RequestOverrides overrides,
    boolean verbose,
    List<String> allowedSubProviders,
    PromptSuite suite
) {

    public CoherencyRun {
        Objects.requireNonNull(targetModelId, "targetModelId must not be null");
        Objects.requireNonNull(targetProviderName, "targetProviderName must not be null");
        if (numWorkers < 1) {
            throw new IllegalArgumentException("numWorkers must be >= 1");
        }
        overrides = overrides == null ? RequestOverrides.none() : overrides;
        allowedSubProviders = allowedSubProviders == null ? List.of() : List.copyOf(allowedSubProviders);
        suite = suite == null ? PromptSuite.defaults() : suite;
    }

    public static CoherencyRun of(String targetModelId, String targetProviderName, int numWorkers) {
        return new CoherencyRun(targetModelId, targetProviderName, numWorkers, null, false, null, null);
    }

    public CoherencyRun withOverrides(RequestOverrides value) {
        return new CoherencyRun(targetModelId, targetProviderName, numWorkers, value, verbose, allowedSubProviders, suite);
    }

    public CoherencyRun withVerbose(boolean value) {
        return new CoherencyRun(targetModelId, targetProviderName, numWorkers, overrides, value, allowedSubProviders, suite);
    }

    public CoherencyRun withAllowedSubProviders(List<String> value) {
        return new CoherencyRun(targetModelId, targetProviderName, numWorkers, overrides, verbose, value, suite);
    }

    public CoherencyRun withSuite(PromptSuite value) {
        return new CoherencyRun(targetModelId, targetProviderName, numWorkers, overrides, verbose, allowedSubProviders, value);
    }
}

package io.llmbridge.core.coherency;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

public record CoherencyReport(boolean success, Set<String> failedProviders, List<CoherencyResult> results) {

    public CoherencyReport {
        failedProviders = failedProviders == null
            ? Set.of()
            : Collections.unmodifiableSortedSet(new TreeSet<>(failedProviders));
        results = results == null ? List.of() : List.copyOf(results);
    }
}

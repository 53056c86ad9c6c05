package io.llmbridge.core.credential;

import java.util.Map;
import java.util.Optional;

public final class EnvironmentCredentialResolver implements CredentialResolver {
    private final Map<String, String> environment;

    public EnvironmentCredentialResolver(Map<String, String> environment) {
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    @Override
    public Optional<String> resolve(String slot) {
        if (slot == null || slot.isBlank()) {
            return Optional.empty();
        }
        String value = environment.get(slot);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}

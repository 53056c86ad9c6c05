package io.llmbridge.core.credential;

import java.util.Map;
import java.util.Optional;

/**
 * Looks up the API key for a credential slot, normally the name of an environment variable such
 * as {@code OPENROUTER_API_KEY}. Blank values count as absent.
 */
@FunctionalInterface
public interface CredentialResolver {
    Optional<String> resolve(String slot);

    default CredentialResolver orElse(CredentialResolver fallback) {
        return slot -> {
            Optional<String> first = resolve(slot);
            return first.isPresent() ? first : fallback.resolve(slot);
        };
    }

    static CredentialResolver fromEnvironment() {
        return new EnvironmentCredentialResolver(System.getenv());
    }

    static CredentialResolver fromMap(Map<String, String> values) {
        return new EnvironmentCredentialResolver(values);
    }
}

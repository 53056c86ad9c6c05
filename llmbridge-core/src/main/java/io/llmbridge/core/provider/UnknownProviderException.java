package io.llmbridge.core.provider;

import java.util.Collection;

public class UnknownProviderException extends IllegalArgumentException {

    public UnknownProviderException(String name, Collection<String> known) {
        super("Unknown provider: '" + name + "'. Valid providers are: " + String.join(", ", known));
    }
}

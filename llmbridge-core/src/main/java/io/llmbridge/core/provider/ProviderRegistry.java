package io.llmbridge.core.provider;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

public final class ProviderRegistry {
    private final Map<String, LlmProvider> providers = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();

    public void register(LlmProvider provider) {
        providers.put(normalize(provider.name()), provider);
    }

    public void alias(String alias, String target) {
        aliases.put(normalize(alias), normalize(target));
    }

    public Optional<LlmProvider> find(String name) {
        String key = normalize(name);
        return Optional.ofNullable(providers.get(aliases.getOrDefault(key, key)));
    }

    public LlmProvider require(String name) {
        return find(name).orElseThrow(() -> new UnknownProviderException(name, names()));
    }

    public List<String> names() {
        return List.copyOf(new TreeMap<>(providers).keySet());
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}

package io.llmbridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderSettings(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders
) {

    public ProviderSettings {
        apiKey = apiKey == null ? "" : apiKey;
        extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    public static ProviderSettings defaults() {
        return new ProviderSettings("", null, Map.of());
    }

    public boolean configured() {
        return !apiKey.isBlank();
    }

    public boolean hasApiBase() {
        return apiBase != null && !apiBase.isBlank();
    }
}

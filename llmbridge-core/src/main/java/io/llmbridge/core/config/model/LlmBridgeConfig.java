package io.llmbridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LlmBridgeConfig(
    ProvidersConfig providers,
    RetrySettings retry,
    HttpSettings http,
    CoherencySettings coherency
) {

    public static LlmBridgeConfig defaults() {
        return new LlmBridgeConfig(
            ProvidersConfig.defaults(),
            RetrySettings.defaults(),
            HttpSettings.defaults(),
            CoherencySettings.defaults()
        );
    }
}

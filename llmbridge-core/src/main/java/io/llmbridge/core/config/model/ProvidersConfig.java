package io.llmbridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderSettings openai,
    ProviderSettings openrouter,
    ProviderSettings fireworks,
    ProviderSettings chutes,
    ProviderSettings google,
    ProviderSettings xai,
    ProviderSettings moonshot,
    ProviderSettings tngtech
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderSettings.defaults(),
            new ProviderSettings("", null, Map.of(
                "HTTP-Referer", "https://SpeechMap.ai",
                "X-Title", "SpeechMap.ai"
            )),
            ProviderSettings.defaults(),
            ProviderSettings.defaults(),
            ProviderSettings.defaults(),
            ProviderSettings.defaults(),
            ProviderSettings.defaults(),
            ProviderSettings.defaults()
        );
    }

    public ProviderSettings settingsFor(String provider) {
        ProviderSettings settings = switch (provider == null ? "" : provider.toLowerCase(Locale.ROOT)) {
            case "openai" -> openai;
            case "openrouter" -> openrouter;
            case "fireworks" -> fireworks;
            case "chutes" -> chutes;
            case "google" -> google;
            case "xai" -> xai;
            case "moonshot" -> moonshot;
            case "tngtech" -> tngtech;
            default -> null;
        };
        return settings == null ? ProviderSettings.defaults() : settings;
    }
}

package io.llmbridge.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmbridge.core.config.model.HttpSettings;
import io.llmbridge.core.config.model.LlmBridgeConfig;
import io.llmbridge.core.config.model.ProviderSettings;
import io.llmbridge.core.config.model.ProvidersConfig;
import io.llmbridge.core.credential.CredentialResolver;
import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.ErrorType;
import io.llmbridge.core.model.LlmResponse;
import io.llmbridge.core.model.RequestTimeout;
import io.llmbridge.core.retry.RetryOrchestrator;
import io.llmbridge.core.retry.RetryPolicy;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.Test;

class ProviderCatalogTest {

    @Test
    void shouldRegisterAllBuiltInProviders() {
        ProviderRegistry registry = new ProviderCatalog(LlmBridgeConfig.defaults(), CredentialResolver.fromMap(Map.of()))
            .createRegistry();

        assertThat(registry.names())
            .containsExactly("chutes", "fireworks", "google", "moonshot", "openai", "openrouter", "tngtech", "xai");
        assertThat(registry.require("OpenRouter")).isInstanceOf(OpenRouterProvider.class);
        assertThat(registry.require("gemini")).isInstanceOf(GoogleProvider.class);
        assertThat(registry.require("openrouter").supportsRouting()).isTrue();
        assertThat(registry.require("openai").supportsRouting()).isFalse();
        assertThat(registry.require("google").supportsStreaming()).isFalse();
    }

    @Test
    void shouldThrowConfigurationErrorForUnknownProvider() {
        ProviderRegistry registry = new ProviderCatalog(LlmBridgeConfig.defaults(), CredentialResolver.fromMap(Map.of()))
            .createRegistry();

        assertThatThrownBy(() -> registry.require("nope"))
            .isInstanceOf(UnknownProviderException.class)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unknown provider: 'nope'")
            .hasMessageContaining("openrouter");
    }

    @Test
    void shouldPreferConfiguredKeyOverEnvironment() {
        ProvidersConfig defaults = ProvidersConfig.defaults();
        ProvidersConfig providers = new ProvidersConfig(
            new ProviderSettings("from-config", null, Map.of()),
            defaults.openrouter(),
            defaults.fireworks(),
            defaults.chutes(),
            defaults.google(),
            defaults.xai(),
            defaults.moonshot(),
            defaults.tngtech()
        );
        LlmBridgeConfig config = new LlmBridgeConfig(providers, null, LlmBridgeConfig.defaults().http(), null);
        ProviderCatalog catalog = new ProviderCatalog(config, CredentialResolver.fromMap(Map.of("XAI_API_KEY", "from-env")));

        assertThat(catalog.hasCredential(ProviderCatalog.OPENAI)).isTrue();
        assertThat(catalog.hasCredential(ProviderCatalog.XAI)).isTrue();
        assertThat(catalog.hasCredential(ProviderCatalog.FIREWORKS)).isFalse();
    }

    @Test
    void shouldTreatBlankEnvironmentValueAsMissing() {
        CredentialResolver resolver = CredentialResolver.fromMap(Map.of("CHUTES_API_TOKEN", "  "));

        assertThat(resolver.resolve("CHUTES_API_TOKEN")).isEmpty();
        assertThat(resolver.orElse(CredentialResolver.fromMap(Map.of("CHUTES_API_TOKEN", "t"))).resolve("CHUTES_API_TOKEN"))
            .contains("t");
    }

    @Test
    void shouldDeriveDefaultTimeoutFromHttpSettings() {
        HttpSettings http = new HttpSettings(Duration.ofSeconds(2), Duration.ofSeconds(7), Duration.ofSeconds(2), 4);

        assertThat(ProviderCatalog.defaultTimeout(http))
            .isEqualTo(RequestTimeout.of(Duration.ofSeconds(2), Duration.ofSeconds(7)));
        assertThat(ProviderCatalog.defaultTimeout(null)).isEqualTo(AbstractHttpLlmProvider.DEFAULT_TIMEOUT);
    }

    @Test
    void shouldApplyConfiguredReadTimeoutToRequestsWithoutTimeout() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[{\"message\":{\"content\":\"late\"},\"finish_reason\":\"stop\"}]}")
                .setBodyDelay(3, TimeUnit.SECONDS));
            server.start();
            ProvidersConfig defaults = ProvidersConfig.defaults();
            ProvidersConfig providers = new ProvidersConfig(
                new ProviderSettings("sk-test", server.url("/v1").toString(), Map.of()),
                defaults.openrouter(),
                defaults.fireworks(),
                defaults.chutes(),
                defaults.google(),
                defaults.xai(),
                defaults.moonshot(),
                defaults.tngtech()
            );
            HttpSettings http = new HttpSettings(Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofSeconds(5), 4);
            LlmBridgeConfig config = new LlmBridgeConfig(providers, null, http, null);
            LlmProvider openai = new ProviderCatalog(config, CredentialResolver.fromMap(Map.of())).createRegistry().require("openai");

            long started = System.nanoTime();
            LlmResponse response = new RetryOrchestrator(RetryPolicy.defaults().withMaxRetries(0))
                .execute(openai, CanonicalRequest.ofPrompt("gpt-4o", "hi"));

            assertThat(response.success()).isFalse();
            assertThat(response.errorInfo().type()).isEqualTo(ErrorType.TIMEOUT);
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(2900));
        }
    }
}

package io.llmbridge.core.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmbridge.core.config.model.HttpSettings;
import io.llmbridge.core.config.model.LlmBridgeConfig;
import io.llmbridge.core.config.model.ProviderSettings;
import io.llmbridge.core.credential.CredentialResolver;
import io.llmbridge.core.model.RequestTimeout;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

/**
 * Built-in provider definitions and the wiring that turns configuration into a
 * {@link ProviderRegistry}. All adapters share one {@link OkHttpClient}.
 */
public final class ProviderCatalog {
    public static final ProviderDefinition OPENAI =
        new ProviderDefinition("openai", "https://api.openai.com/v1", "OPENAI_API_KEY", ReasoningStyle.REASONING_EFFORT);
    public static final ProviderDefinition OPENROUTER =
        new ProviderDefinition("openrouter", "https://openrouter.ai/api/v1", "OPENROUTER_API_KEY", ReasoningStyle.REASONING_OBJECT);
    public static final ProviderDefinition FIREWORKS =
        new ProviderDefinition("fireworks", "https://api.fireworks.ai/inference/v1", "FIREWORKS_API_KEY", ReasoningStyle.REASONING_EFFORT);
    public static final ProviderDefinition CHUTES =
        new ProviderDefinition("chutes", "https://llm.chutes.ai/v1", "CHUTES_API_TOKEN", ReasoningStyle.REASONING_OBJECT);
    public static final ProviderDefinition GOOGLE =
        new ProviderDefinition("google", "https://generativelanguage.googleapis.com/v1beta", "GEMINI_API_KEY", ReasoningStyle.REASONING_OBJECT);
    public static final ProviderDefinition XAI =
        new ProviderDefinition("xai", "https://api.x.ai/v1", "XAI_API_KEY", ReasoningStyle.REASONING_EFFORT);
    public static final ProviderDefinition MOONSHOT =
        new ProviderDefinition("moonshot", "https://api.moonshot.ai/v1", "MOONSHOT_API_KEY", ReasoningStyle.REASONING_OBJECT);
    public static final ProviderDefinition TNGTECH =
        new ProviderDefinition("tngtech", "https://chat.model.tngtech.com/v1", "TNGTECH_API_KEY", ReasoningStyle.REASONING_OBJECT);

    public static final List<ProviderDefinition> DEFINITIONS =
        List.of(OPENAI, OPENROUTER, FIREWORKS, CHUTES, GOOGLE, XAI, MOONSHOT, TNGTECH);

    private final LlmBridgeConfig config;
    private final CredentialResolver environment;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public ProviderCatalog(LlmBridgeConfig config, CredentialResolver environment) {
        this(config, environment, sharedClient(config.http()));
    }

    public ProviderCatalog(LlmBridgeConfig config, CredentialResolver environment, OkHttpClient client) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = new ObjectMapper();
    }

    public static OkHttpClient sharedClient(HttpSettings http) {
        return new OkHttpClient.Builder()
            .connectTimeout(http.connectTimeout())
            .readTimeout(http.readTimeout())
            .writeTimeout(http.writeTimeout())
            .connectionPool(new ConnectionPool(Math.max(1, http.maxIdleConnections()), 5, TimeUnit.MINUTES))
            .build();
    }

    /**
     * Timeout applied to requests that carry none of their own.
     */
    public static RequestTimeout defaultTimeout(HttpSettings http) {
        if (http == null || http.readTimeout() == null) {
            return AbstractHttpLlmProvider.DEFAULT_TIMEOUT;
        }
        return RequestTimeout.of(http.connectTimeout(), http.readTimeout());
    }

    public ProviderRegistry createRegistry() {
        ProviderRegistry registry = new ProviderRegistry();
        for (ProviderDefinition definition : DEFINITIONS) {
            registry.register(create(definition));
        }
        registry.alias("gemini", GOOGLE.name());
        return registry;
    }

    public LlmProvider create(ProviderDefinition base) {
        ProviderSettings settings = config.providers().settingsFor(base.name());
        ProviderDefinition definition = settings.hasApiBase() ? base.withApiBase(settings.apiBase()) : base;
        CredentialResolver credentials = configured(definition, settings).orElse(environment);
        Map<String, String> headers = settings.extraHeaders();
        RequestTimeout timeout = defaultTimeout(config.http());
        if (GOOGLE.name().equals(definition.name())) {
            return new GoogleProvider(definition, credentials, client, mapper, headers, timeout);
        }
        if (OPENROUTER.name().equals(definition.name())) {
            return new OpenRouterProvider(definition, credentials, client, mapper, headers, timeout);
        }
        return new OpenAiCompatProvider(definition, credentials, client, mapper, headers, timeout);
    }

    /**
     * @return whether a key is available for {@code definition} from config or environment
     */
    public boolean hasCredential(ProviderDefinition definition) {
        ProviderSettings settings = config.providers().settingsFor(definition.name());
        return configured(definition, settings).orElse(environment).resolve(definition.apiKeyEnv()).isPresent();
    }

    private static CredentialResolver configured(ProviderDefinition definition, ProviderSettings settings) {
        Map<String, String> values = new HashMap<>();
        if (settings.configured()) {
            values.put(definition.apiKeyEnv(), settings.apiKey());
        }
        return CredentialResolver.fromMap(values);
    }
}

package io.llmbridge.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmbridge.core.credential.CredentialResolver;
import io.llmbridge.core.error.FailureKind;
import io.llmbridge.core.error.ProviderException;
import io.llmbridge.core.error.ProviderFailure;
import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.RequestTimeout;
import io.llmbridge.core.retry.CancellationToken;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.ResponseBody;

/**
 * OpenRouter gateway: OpenAI dialect plus sub-provider routing ({@code provider.order} /
 * {@code provider.ignore}) and endpoint enumeration for coherency runs.
 */
public final class OpenRouterProvider extends OpenAiCompatProvider implements SubProviderDirectory {
    private static final RequestTimeout ENDPOINTS_TIMEOUT = RequestTimeout.ofSeconds(30);

    public OpenRouterProvider(
        ProviderDefinition definition,
        CredentialResolver credentials,
        OkHttpClient client,
        ObjectMapper mapper,
        Map<String, String> extraHeaders
    ) {
        super(definition, credentials, client, mapper, extraHeaders);
    }

    public OpenRouterProvider(
        ProviderDefinition definition,
        CredentialResolver credentials,
        OkHttpClient client,
        ObjectMapper mapper,
        Map<String, String> extraHeaders,
        RequestTimeout defaultTimeout
    ) {
        super(definition, credentials, client, mapper, extraHeaders, defaultTimeout);
    }

    @Override
    public boolean supportsRouting() {
        return true;
    }

    @Override
    protected Map<String, Object> buildPayload(CanonicalRequest request) {
        Map<String, Object> payload = super.buildPayload(request);
        Map<String, Object> routing = new LinkedHashMap<>();
        if (!request.allowList().isEmpty()) {
            routing.put("order", request.allowList());
            routing.put("allow_fallbacks", false);
        }
        if (!request.ignoreList().isEmpty()) {
            routing.put("ignore", request.ignoreList());
        }
        if (!routing.isEmpty()) {
            payload.put("provider", routing);
        }
        return payload;
    }

    @Override
    public List<String> listSubProviders(String modelId) throws ProviderException {
        return listSubProviders(modelId, CancellationToken.create());
    }

    public List<String> listSubProviders(String modelId, CancellationToken token) throws ProviderException {
        String apiKey = requireApiKey();
        HttpUrl url = apiBase().newBuilder()
            .addPathSegment("models")
            .addPathSegments(modelId)
            .addPathSegment("endpoints")
            .build();
        Request request = new Request.Builder()
            .url(url)
            .get()
            .header("Authorization", "Bearer " + apiKey)
            .build();
        JsonNode root = call(request, ENDPOINTS_TIMEOUT, false, token, response -> {
            ResponseBody body = response.body();
            return mapper.readTree(body == null ? "{}" : body.string());
        });
        return providerNames(root);
    }

    private static List<String> providerNames(JsonNode root) throws ProviderException {
        JsonNode data = root == null ? null : root.path("data");
        JsonNode endpoints;
        if (data != null && data.isArray()) {
            endpoints = data;
        } else if (data != null && data.path("endpoints").isArray()) {
            endpoints = data.path("endpoints");
        } else {
            throw new ProviderException(
                ProviderFailure.of(FailureKind.OTHER, "Unexpected structure in endpoints response"),
                root
            );
        }
        TreeSet<String> names = new TreeSet<>();
        for (JsonNode endpoint : endpoints) {
            String name = endpoint.path("provider_name").asText("");
            if (!name.isBlank()) {
                names.add(name);
            }
        }
        return new ArrayList<>(names);
    }

    @Override
    protected String extractErrorMessage(JsonNode errorBody, String text) {
        String message = super.extractErrorMessage(errorBody, text);
        JsonNode raw = errorBody == null ? null : errorBody.path("error").path("metadata").path("raw");
        if (raw != null && raw.isTextual() && !raw.asText().isBlank()) {
            return message + " (" + raw.asText() + ")";
        }
        return message;
    }
}

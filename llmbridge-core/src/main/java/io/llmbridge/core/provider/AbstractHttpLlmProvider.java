package io.llmbridge.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmbridge.core.credential.CredentialResolver;
import io.llmbridge.core.error.ErrorClassifier;
import io.llmbridge.core.error.FailureKind;
import io.llmbridge.core.error.ProviderException;
import io.llmbridge.core.error.ProviderFailure;
import io.llmbridge.core.error.RequestValidator;
import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.RequestTimeout;
import io.llmbridge.core.retry.CancellationToken;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared OkHttp plumbing for adapters: credential lookup, per-attempt timeouts, cancellation and
 * the mapping of transport and status failures onto {@link ProviderFailure}. Subclasses only build
 * the wire request and read the wire response.
 */
public abstract class AbstractHttpLlmProvider implements LlmProvider {
    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    protected static final RequestTimeout DEFAULT_TIMEOUT = RequestTimeout.ofSeconds(60);

    private static final Logger LOG = LoggerFactory.getLogger(AbstractHttpLlmProvider.class);
    private static final int MAX_ERROR_TEXT = 500;

    private final ProviderDefinition definition;
    private final HttpUrl apiBase;
    private final CredentialResolver credentials;
    private final OkHttpClient client;
    private final Map<String, String> extraHeaders;
    private final RequestTimeout defaultTimeout;
    protected final ObjectMapper mapper;

    protected AbstractHttpLlmProvider(
        ProviderDefinition definition,
        CredentialResolver credentials,
        OkHttpClient client,
        ObjectMapper mapper,
        Map<String, String> extraHeaders
    ) {
        this(definition, credentials, client, mapper, extraHeaders, DEFAULT_TIMEOUT);
    }

    protected AbstractHttpLlmProvider(
        ProviderDefinition definition,
        CredentialResolver credentials,
        OkHttpClient client,
        ObjectMapper mapper,
        Map<String, String> extraHeaders,
        RequestTimeout defaultTimeout
    ) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.apiBase = HttpUrl.get(definition.apiBase());
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.defaultTimeout = defaultTimeout == null ? DEFAULT_TIMEOUT : defaultTimeout;
    }

    @Override
    public String name() {
        return definition.name();
    }

    protected ProviderDefinition definition() {
        return definition;
    }

    protected HttpUrl apiBase() {
        return apiBase;
    }

    @Override
    public final ProviderReply execute(CanonicalRequest request, CancellationToken token) throws ProviderException {
        Optional<ProviderFailure> violation = RequestValidator.validate(request, supportsStreaming(), supportsRouting());
        if (violation.isPresent()) {
            throw new ProviderException(violation.get());
        }
        String apiKey = requireApiKey();
        Request.Builder builder = buildRequest(request, apiKey);
        extraHeaders.forEach(builder::header);
        Request httpRequest = builder.build();

        if (request.streaming()) {
            LOG.debug("{} streaming request to {}", name(), httpRequest.url().redact());
            return call(httpRequest, request.timeout(), true, token, response -> parseStream(body(response).source()));
        }
        LOG.debug("{} request to {}", name(), httpRequest.url().redact());
        JsonNode root = call(httpRequest, request.timeout(), false, token, response -> readJson(body(response)));
        return parseReply(root);
    }

    /**
     * @return a request builder carrying URL, method, body and auth headers
     */
    protected abstract Request.Builder buildRequest(CanonicalRequest request, String apiKey) throws ProviderException;

    protected abstract ProviderReply parseReply(JsonNode body) throws ProviderException;

    protected ProviderReply parseStream(BufferedSource source) throws IOException, ProviderException {
        throw new ProviderException(ProviderFailure.contractViolation("Provider '" + name() + "' does not support streaming"));
    }

    protected String requireApiKey() throws ProviderException {
        return credentials.resolve(definition.apiKeyEnv()).orElseThrow(() -> new ProviderException(ProviderFailure.of(
            FailureKind.MISSING_CREDENTIAL,
            "Missing API key for provider '" + name() + "'; set " + definition.apiKeyEnv()
        )));
    }

    /**
     * Executes one HTTP exchange. Non-2xx statuses become {@link FailureKind#HTTP_STATUS} failures;
     * I/O errors become transport failures, or cancellation when the token stopped the call.
     */
    protected final <T> T call(
        Request httpRequest,
        RequestTimeout timeout,
        boolean streaming,
        CancellationToken token,
        ResponseHandler<T> handler
    ) throws ProviderException {
        RequestTimeout effective = timeout == null ? defaultTimeout : timeout;
        Call call = clientFor(effective, streaming).newCall(httpRequest);
        applyDeadline(call, effective, token);
        try (CancellationToken.Registration ignored = token.onCancel(call::cancel);
             Response response = call.execute()) {
            if (!response.isSuccessful()) {
                throw statusFailure(response);
            }
            return handler.handle(response);
        } catch (IOException e) {
            throw transportFailure(e, token);
        }
    }

    protected String extractErrorMessage(JsonNode errorBody, String text) {
        JsonNode error = errorBody == null ? null : errorBody.path("error");
        if (error != null && error.isObject() && error.hasNonNull("message")) {
            return error.path("message").asText();
        }
        if (error != null && error.isTextual()) {
            return error.asText();
        }
        if (errorBody != null && errorBody.hasNonNull("message")) {
            return errorBody.path("message").asText();
        }
        return truncate(text);
    }

    private OkHttpClient clientFor(RequestTimeout timeout, boolean streaming) {
        OkHttpClient.Builder builder = client.newBuilder();
        if (timeout.connect() != null) {
            builder.connectTimeout(timeout.connect());
        }
        Duration read = streaming ? timeout.effectiveStreamIdle() : timeout.read();
        return builder.readTimeout(read).build();
    }

    private void applyDeadline(Call call, RequestTimeout timeout, CancellationToken token) {
        Duration total = timeout.total();
        Optional<Duration> remaining = token.remaining();
        if (remaining.isPresent() && remaining.get().compareTo(total) < 0) {
            total = remaining.get();
        }
        call.timeout().timeout(Math.max(1, total.toMillis()), TimeUnit.MILLISECONDS);
    }

    private ProviderException statusFailure(Response response) throws IOException {
        ResponseBody body = response.body();
        String text = body == null ? "" : body.string();
        JsonNode json = tryParse(text);
        String message = "HTTP " + response.code() + ": " + extractErrorMessage(json, text);
        LOG.debug("{} returned HTTP {}", name(), response.code());
        return new ProviderException(ProviderFailure.httpStatus(response.code(), message), json);
    }

    private ProviderException transportFailure(IOException e, CancellationToken token) {
        if (token.isCancelled()) {
            return new ProviderException(ProviderFailure.of(FailureKind.CANCELLED, "Request cancelled"), null, e);
        }
        if (token.deadlineExceeded()) {
            return new ProviderException(ProviderFailure.of(FailureKind.TIMEOUT, "Deadline exceeded"), null, e);
        }
        return new ProviderException(ErrorClassifier.failureOf(e), null, e);
    }

    private JsonNode readJson(ResponseBody body) throws IOException, ProviderException {
        String text = body.string();
        JsonNode root = tryParse(text);
        if (root == null || !root.isObject()) {
            throw new ProviderException(ProviderFailure.of(
                FailureKind.OTHER,
                "Unparseable response body from " + name() + ": " + truncate(text)
            ));
        }
        return root;
    }

    private static ResponseBody body(Response response) throws IOException {
        ResponseBody body = response.body();
        if (body == null) {
            throw new IOException("Empty response body");
        }
        return body;
    }

    private JsonNode tryParse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(text);
        } catch (IOException e) {
            return null;
        }
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_ERROR_TEXT ? text : text.substring(0, MAX_ERROR_TEXT) + "...";
    }

    @FunctionalInterface
    protected interface ResponseHandler<T> {
        T handle(Response response) throws IOException, ProviderException;
    }
}

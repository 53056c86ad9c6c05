package io.llmbridge.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmbridge.core.credential.CredentialResolver;
import io.llmbridge.core.error.FailureKind;
import io.llmbridge.core.error.ProviderException;
import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.ChatMessage;
import io.llmbridge.core.model.ReasoningOptions;
import io.llmbridge.core.model.Transport;
import io.llmbridge.core.retry.CancellationToken;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GoogleProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private GoogleProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        provider = new GoogleProvider(
            new ProviderDefinition("google", server.url("/v1beta").toString(), "GEMINI_API_KEY", ReasoningStyle.REASONING_OBJECT),
            CredentialResolver.fromMap(Map.of("GEMINI_API_KEY", "g-key")),
            new OkHttpClient(),
            mapper,
            Map.of()
        );
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldStandardizeGenerateContentResponse() throws Exception {
        server.enqueue(new MockResponse().setBody("""
            {
              "candidates": [{
                "content": {"role": "model", "parts": [
                  {"text": "planning", "thought": true},
                  {"text": "Hello "},
                  {"text": "there"}
                ]},
                "finishReason": "STOP"
              }],
              "usageMetadata": {"promptTokenCount": 4, "candidatesTokenCount": 2, "totalTokenCount": 6, "thoughtsTokenCount": 9},
              "modelVersion": "gemini-2.5-flash"
            }
            """));

        ProviderReply reply = provider.execute(CanonicalRequest.ofPrompt("gemini-2.5-flash", "hi"), CancellationToken.create());

        assertThat(reply.response().content()).isEqualTo("Hello there");
        assertThat(reply.response().reasoning()).isEqualTo("planning");
        assertThat(reply.response().finishReason()).isEqualTo("stop");
        assertThat(reply.response().model()).isEqualTo("gemini-2.5-flash");
        assertThat(reply.response().usage().promptTokens()).isEqualTo(4);
        assertThat(reply.response().usage().completionTokens()).isEqualTo(2);
        assertThat(reply.response().usage().totalTokens()).isEqualTo(6);
        assertThat(reply.response().id()).isEmpty();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1beta/models/gemini-2.5-flash:generateContent?key=g-key");
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("contents")).hasSize(1);
        assertThat(body.path("contents").get(0).has("role")).isFalse();
        assertThat(body.path("contents").get(0).path("parts").get(0).path("text").asText()).isEqualTo("hi");
        assertThat(body.path("safetySettings")).hasSize(4);
        assertThat(body.path("safetySettings").get(0).path("threshold").asText()).isEqualTo("BLOCK_NONE");
    }

    @Test
    void shouldMapConversationRolesAndDropEmptyMessages() throws Exception {
        server.enqueue(ok());

        provider.execute(
            CanonicalRequest.of("gemini-pro", List.of(
                ChatMessage.system("rules"),
                ChatMessage.user("question"),
                ChatMessage.assistant(""),
                ChatMessage.assistant("answer"),
                ChatMessage.user("follow up"))),
            CancellationToken.create()
        );

        JsonNode contents = mapper.readTree(server.takeRequest().getBody().readUtf8()).path("contents");
        assertThat(contents).hasSize(4);
        assertThat(contents.get(0).path("role").asText()).isEqualTo("user");
        assertThat(contents.get(2).path("role").asText()).isEqualTo("model");
        assertThat(contents.get(2).path("parts").get(0).path("text").asText()).isEqualTo("answer");
    }

    @Test
    void shouldSendThinkingConfig() throws Exception {
        server.enqueue(ok());

        provider.execute(
            CanonicalRequest.ofPrompt("gemini-2.5-pro", "hi").withReasoning(ReasoningOptions.withBudget(512)),
            CancellationToken.create()
        );

        JsonNode thinking = mapper.readTree(server.takeRequest().getBody().readUtf8())
            .path("generationConfig").path("thinkingConfig");
        assertThat(thinking.path("thinkingBudget").asInt()).isEqualTo(512);
        assertThat(thinking.path("includeThoughts").asBoolean()).isTrue();
    }

    @Test
    void shouldMapBlockedPromptToContentFilter() {
        server.enqueue(new MockResponse().setBody("{\"promptFeedback\":{\"blockReason\":\"SAFETY\"}}"));

        assertThatThrownBy(() -> provider.execute(CanonicalRequest.ofPrompt("gemini-pro", "hi"), CancellationToken.create()))
            .isInstanceOfSatisfying(ProviderException.class, e -> {
                assertThat(e.failure().kind()).isEqualTo(FailureKind.CONTENT_FILTER);
                assertThat(e.getMessage()).isEqualTo("Prompt blocked due to: SAFETY");
            });
    }

    @Test
    void shouldMapSafetyFinishToContentFilter() {
        server.enqueue(new MockResponse().setBody("{\"candidates\":[{\"finishReason\":\"RECITATION\"}]}"));

        assertThatThrownBy(() -> provider.execute(CanonicalRequest.ofPrompt("gemini-pro", "hi"), CancellationToken.create()))
            .isInstanceOfSatisfying(ProviderException.class,
                e -> assertThat(e.failure().kind()).isEqualTo(FailureKind.CONTENT_FILTER));
    }

    @Test
    void shouldRejectStreamingTransport() {
        assertThatThrownBy(() -> provider.execute(
            CanonicalRequest.ofPrompt("gemini-pro", "hi").withTransport(Transport.STREAM),
            CancellationToken.create()))
            .isInstanceOfSatisfying(ProviderException.class,
                e -> assertThat(e.failure().kind()).isEqualTo(FailureKind.CONTRACT_VIOLATION));
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldMapFinishReasons() {
        assertThat(GoogleResponseStandardizer.finishReason("MAX_TOKENS")).isEqualTo("length");
        assertThat(GoogleResponseStandardizer.finishReason("SAFETY")).isEqualTo("content_filter");
        assertThat(GoogleResponseStandardizer.finishReason("OTHER")).isEqualTo("error");
        assertThat(GoogleResponseStandardizer.finishReason("BLOCKLIST")).isEqualTo("blocklist");
        assertThat(GoogleResponseStandardizer.finishReason(null)).isNull();
    }

    private static MockResponse ok() {
        return new MockResponse().setBody("""
            {"candidates": [{"content": {"parts": [{"text": "ok"}]}, "finishReason": "STOP"}]}
            """);
    }
}

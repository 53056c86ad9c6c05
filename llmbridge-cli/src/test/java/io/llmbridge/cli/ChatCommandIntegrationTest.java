package io.llmbridge.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmbridge.core.config.ConfigService;
import io.llmbridge.core.credential.CredentialResolver;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ChatCommandIntegrationTest {

    private MockWebServer server;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldPrintAnswerFromConfiguredProvider() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "choices": [
                    { "message": { "content": "integration-ok" }, "finish_reason": "stop" }
                  ]
                }
                """));

        int code = execute("-p", "openai", "-m", "gpt-4o", "-s", "be brief", "--max-tokens", "64", "hello");

        assertThat(code).isEqualTo(0);
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("integration-ok");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.path("messages")).hasSize(2);
        assertThat(body.path("max_tokens").asInt()).isEqualTo(64);
    }

    @Test
    void shouldReportClassifiedFailure() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(401)
            .setBody("{\"error\":{\"message\":\"Incorrect API key provided\"}}"));

        int code = execute("-p", "openai", "-m", "gpt-4o", "hello");

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8))
            .contains("Request failed (auth)")
            .contains("Incorrect API key provided");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectRoutingListsForDirectProviderWithoutCallingIt() throws Exception {
        int code = execute("-p", "openai", "-m", "gpt-4o", "--allow", "DeepInfra", "hello");

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Request failed (invalid_option)");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldFailForUnknownProvider() throws Exception {
        int code = execute("-p", "nope", "-m", "gpt-4o", "hello");

        assertThat(code).isEqualTo(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("Chat command failed: Unknown provider: 'nope'");
    }

    private int execute(String... args) throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "providers": {
                "openai": {
                  "apiKey": "sk-test",
                  "apiBase": "%s"
                }
              },
              "retry": { "maxRetries": 0 }
            }
            """.formatted(server.url("/v1").toString()), StandardCharsets.UTF_8);
        CliContext context = new CliContext(new ConfigService(), configPath, CredentialResolver.fromMap(Map.of()));

        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            return new CommandLine(new ChatCommand(context)).execute(args);
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }
}

package io.llmbridge.cli;

import static org.assertj.core.api.Assertions.assertThat;

import io.llmbridge.core.config.ConfigService;
import io.llmbridge.core.credential.CredentialResolver;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CoherencyCommandTest {

    private MockWebServer server;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.setDispatcher(new GatewayDispatcher());
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldReportEachSubProviderAndOverallResult() throws Exception {
        int code = execute("-m", "vendor/model", "-w", "2", "--prompts", promptsFile().toString());

        String output = out.toString(StandardCharsets.UTF_8);
        assertThat(code).isEqualTo(0);
        assertThat(output)
            .contains("PASS openrouter/DeepInfra")
            .contains("FAIL openrouter/Together")
            .contains("short: empty response")
            .contains("Failed providers: Together")
            .contains("Overall: PASSED");
    }

    @Test
    void shouldExitNonZeroWhenEveryForcedSubProviderFails() throws Exception {
        int code = execute("-m", "vendor/model", "--force-subproviders", "together", "--prompts", promptsFile().toString());

        String output = out.toString(StandardCharsets.UTF_8);
        assertThat(code).isEqualTo(1);
        assertThat(output).doesNotContain("DeepInfra").contains("Overall: FAILED");
    }

    private Path promptsFile() throws IOException {
        Path file = tempDir.resolve("prompts.json");
        Files.writeString(file, "[{\"id\": \"short\", \"prompt\": \"Say something.\"}]", StandardCharsets.UTF_8);
        return file;
    }

    private int execute(String... args) throws IOException {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "providers": {
                "openrouter": { "apiKey": "sk-or", "apiBase": "%s" }
              },
              "retry": { "maxRetries": 0 }
            }
            """.formatted(server.url("/api/v1").toString()), StandardCharsets.UTF_8);
        CliContext context = new CliContext(new ConfigService(), configPath, CredentialResolver.fromMap(Map.of()));

        PrintStream originalOut = System.out;
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            return new CommandLine(new CoherencyCommand(context)).execute(args);
        } finally {
            System.setOut(originalOut);
        }
    }

    private static final class GatewayDispatcher extends Dispatcher {

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String path = request.getPath() == null ? "" : request.getPath();
            if (path.endsWith("/endpoints")) {
                return new MockResponse().setBody("""
                    {"data": {"endpoints": [{"provider_name": "Together"}, {"provider_name": "DeepInfra"}]}}
                    """);
            }
            String body = request.getBody().readUtf8();
            String content = body.contains("\"DeepInfra\"") ? "Here is something." : "";
            return new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"choices\":[{\"message\":{\"content\":\"" + content + "\"},\"finish_reason\":\"stop\"}]}");
        }
    }
}

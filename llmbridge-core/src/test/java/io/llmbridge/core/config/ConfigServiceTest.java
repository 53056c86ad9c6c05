package io.llmbridge.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.llmbridge.core.config.model.LlmBridgeConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        LlmBridgeConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.retry().maxRetries()).isEqualTo(3);
        assertThat(config.retry().baseDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.http().connectTimeout()).isEqualTo(Duration.ofSeconds(20));
        assertThat(config.coherency().numWorkers()).isEqualTo(4);
        assertThat(config.providers().openrouter().configured()).isFalse();
        assertThat(config.providers().openrouter().extraHeaders()).containsEntry("X-Title", "SpeechMap.ai");
    }

    @Test
    void shouldMergePartialFileOverDefaults() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "providers": {
                "openrouter": {
                  "apiKey": "sk-or",
                  "extraHeaders": { "X-Title": "Mine" }
                }
              },
              "retry": { "maxRetries": 6, "baseDelay": "PT2S" }
            }
            """);

        LlmBridgeConfig config = service.load(configPath);

        assertThat(config.providers().openrouter().apiKey()).isEqualTo("sk-or");
        assertThat(config.providers().openrouter().extraHeaders())
            .containsEntry("X-Title", "Mine")
            .containsEntry("HTTP-Referer", "https://SpeechMap.ai");
        assertThat(config.providers().openai().apiKey()).isEmpty();
        assertThat(config.retry().maxRetries()).isEqualTo(6);
        assertThat(config.retry().baseDelay()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.retry().maxDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.retry().toPolicy().maxRetries()).isEqualTo(6);
    }

    @Test
    void shouldAcceptSnakeCaseKeys() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "providers": {
                "openai": { "api_key": "sk-openai", "api_base": "http://localhost:9999/v1" },
                "tngtech": { "extra_headers": { "X_Custom": "kept" } }
              },
              "coherency": { "num_workers": 8, "judge_model": "gpt-4.1" }
            }
            """);

        LlmBridgeConfig config = service.load(configPath);

        assertThat(config.providers().openai().apiKey()).isEqualTo("sk-openai");
        assertThat(config.providers().openai().apiBase()).isEqualTo("http://localhost:9999/v1");
        assertThat(config.providers().tngtech().extraHeaders()).containsEntry("X_Custom", "kept");
        assertThat(config.coherency().numWorkers()).isEqualTo(8);
        assertThat(config.coherency().judgeModel()).isEqualTo("gpt-4.1");
        assertThat(config.coherency().judgeProvider()).isEqualTo("openai");
    }

    @Test
    void shouldSaveConfigThatLoadsBack() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("nested/config.json");

        service.save(configPath, LlmBridgeConfig.defaults());

        assertThat(Files.readString(configPath)).contains("\"baseDelay\" : \"PT1S\"");
        assertThat(service.load(configPath)).isEqualTo(LlmBridgeConfig.defaults());
    }

    @Test
    void shouldExpandHomeInConfiguredPaths() {
        Path resolved = ConfigPaths.resolve("~/prompts.json");

        assertThat(resolved).isEqualTo(Path.of(System.getProperty("user.home"), "prompts.json"));
        assertThat(ConfigPaths.resolve(" ")).isNull();
    }
}

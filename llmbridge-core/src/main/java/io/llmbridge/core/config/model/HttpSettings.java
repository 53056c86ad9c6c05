package io.llmbridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record HttpSettings(
    @JsonAlias({"connect_timeout"}) Duration connectTimeout,
    @JsonAlias({"read_timeout"}) Duration readTimeout,
    @JsonAlias({"write_timeout"}) Duration writeTimeout,
    @JsonAlias({"max_idle_connections"}) int maxIdleConnections
) {

    public static HttpSettings defaults() {
        return new HttpSettings(Duration.ofSeconds(20), Duration.ofSeconds(60), Duration.ofSeconds(20), 16);
    }
}

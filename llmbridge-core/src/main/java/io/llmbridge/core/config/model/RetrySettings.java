package io.llmbridge.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.llmbridge.core.retry.RetryPolicy;
import java.time.Duration;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrySettings(
    @JsonAlias({"max_retries"}) int maxRetries,
    @JsonAlias({"base_delay"}) Duration baseDelay,
    @JsonAlias({"max_delay"}) Duration maxDelay,
    @JsonAlias({"jitter_ratio"}) double jitterRatio
) {

    public static RetrySettings defaults() {
        return new RetrySettings(
            RetryPolicy.DEFAULT_MAX_RETRIES,
            RetryPolicy.DEFAULT_BASE_DELAY,
            RetryPolicy.DEFAULT_MAX_DELAY,
            RetryPolicy.DEFAULT_JITTER_RATIO
        );
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(
            maxRetries,
            baseDelay == null ? RetryPolicy.DEFAULT_BASE_DELAY : baseDelay,
            maxDelay == null ? RetryPolicy.DEFAULT_MAX_DELAY : maxDelay,
            jitterRatio
        );
    }
}

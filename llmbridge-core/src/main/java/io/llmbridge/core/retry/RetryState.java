package io.llmbridge.core.retry;

import io.llmbridge.core.model.ErrorInfo;
import io.llmbridge.core.model.LlmResponse;
import java.time.Duration;
import java.time.Instant;

/**
 * Immutable snapshot of a retry loop between attempts.
 */
public record RetryState(int attempts, Instant startedAt, LlmResponse lastResponse) {

    public static RetryState start(Instant now) {
        return new RetryState(0, now, null);
    }

    public RetryState record(LlmResponse response) {
        return new RetryState(attempts + 1, startedAt, response);
    }

    public ErrorInfo lastError() {
        return lastResponse == null ? null : lastResponse.errorInfo();
    }

    public int retriesUsed() {
        return Math.max(0, attempts - 1);
    }

    public boolean exhausted(int maxRetries) {
        return retriesUsed() >= maxRetries;
    }

    public Duration elapsed(Instant now) {
        return Duration.between(startedAt, now);
    }
}

package io.llmbridge.core.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: the n-th retry waits {@code min(baseDelay * 2^n, maxDelay)} scaled by a
 * uniform factor in {@code [1 - jitterRatio, 1 + jitterRatio]}.
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, double jitterRatio) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    public static final double DEFAULT_JITTER_RATIO = 0.2;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        if (jitterRatio < 0 || jitterRatio >= 1) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1)");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_JITTER_RATIO);
    }

    public RetryPolicy withMaxRetries(int value) {
        return new RetryPolicy(value, baseDelay, maxDelay, jitterRatio);
    }

    /**
     * @param retryIndex zero for the first retry
     * @param unitRandom a value in {@code [0, 1)}
     */
    public Duration delayFor(int retryIndex, double unitRandom) {
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        long exponential = base;
        for (int i = 0; i < retryIndex && exponential < cap; i++) {
            exponential = exponential * 2;
        }
        long bounded = Math.min(exponential, cap);
        double factor = 1 + jitterRatio * (2 * unitRandom - 1);
        return Duration.ofMillis(Math.max(0, Math.round(bounded * factor)));
    }
}

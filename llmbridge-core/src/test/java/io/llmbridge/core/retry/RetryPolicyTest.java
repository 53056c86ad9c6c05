package io.llmbridge.core.retry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

    private final RetryPolicy policy = RetryPolicy.defaults();

    @Test
    void shouldDoubleDelayPerRetryWithoutJitterAtMidpoint() {
        assertThat(policy.delayFor(0, 0.5)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.delayFor(1, 0.5)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(2, 0.5)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delayFor(4, 0.5)).isEqualTo(Duration.ofSeconds(16));
    }

    @Test
    void shouldCapDelay() {
        assertThat(policy.delayFor(5, 0.5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.delayFor(40, 0.5)).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldApplyJitterWithinBounds() {
        assertThat(policy.delayFor(0, 0.0)).isEqualTo(Duration.ofMillis(800));
        assertThat(policy.delayFor(0, 0.999999)).isLessThanOrEqualTo(Duration.ofMillis(1200));
        assertThat(policy.delayFor(40, 0.999999)).isLessThanOrEqualTo(Duration.ofSeconds(36));
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(-1, Duration.ofSeconds(1), Duration.ofSeconds(2), 0.2))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(1, Duration.ofSeconds(1), Duration.ofSeconds(2), 1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

package io.llmbridge.core.retry;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
    void sleep(Duration duration, CancellationToken token);

    static Sleeper blocking() {
        return (duration, token) -> token.sleep(duration);
    }
}

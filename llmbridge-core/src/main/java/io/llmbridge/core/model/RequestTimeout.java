package io.llmbridge.core.model;

import java.time.Duration;

/**
 * Connect/read bounds for one attempt. {@code connect} may be null when the caller supplied a
 * single scalar timeout, in which case the HTTP client default applies to connection setup.
 * {@code streamIdle} bounds the gap between two SSE events and falls back to {@code read}.
 */
public record RequestTimeout(Duration connect, Duration read, Duration streamIdle) {

    public static RequestTimeout ofSeconds(double seconds) {
        return new RequestTimeout(null, toDuration(seconds), null);
    }

    public static RequestTimeout of(Duration connect, Duration read) {
        return new RequestTimeout(connect, read, null);
    }

    public RequestTimeout withStreamIdle(Duration idle) {
        return new RequestTimeout(connect, read, idle);
    }

    public Duration effectiveStreamIdle() {
        return streamIdle == null ? read : streamIdle;
    }

    public Duration total() {
        Duration total = read == null ? Duration.ZERO : read;
        return connect == null ? total : total.plus(connect);
    }

    public boolean isValid() {
        return positive(read)
            && (connect == null || positive(connect))
            && (streamIdle == null || positive(streamIdle));
    }

    private static boolean positive(Duration value) {
        return value != null && !value.isNegative() && !value.isZero();
    }

    private static Duration toDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
    }
}

package io.llmbridge.core.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caller-controlled stop signal for a logical call or a whole coherency run. Cancellation is
 * either explicit ({@link #cancel()}) or deadline-driven; the two surface as different error
 * kinds. Thread-safe: one token may be observed by many workers.
 */
public final class CancellationToken {
    private static final Logger LOG = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(deadline, clock);
    }

    /**
     * Returns a token that is cancelled whenever this one is, and may also be cancelled on its own.
     * The child keeps the earlier of the two deadlines.
     */
    public CancellationToken child(Duration timeout) {
        Instant childDeadline = timeout == null ? null : clock.instant().plus(timeout);
        if (deadline != null && (childDeadline == null || deadline.isBefore(childDeadline))) {
            childDeadline = deadline;
        }
        CancellationToken child = new CancellationToken(childDeadline, clock);
        Registration link = onCancel(child::cancel);
        child.onCancel(link::close);
        return child;
    }

    public CancellationToken child() {
        return child(null);
    }

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                LOG.warn("Cancellation listener failed: {}", e.getMessage());
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public boolean deadlineExceeded() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean shouldStop() {
        return isCancelled() || deadlineExceeded();
    }

    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(clock.instant(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Runs {@code listener} on cancellation, immediately if the token is already cancelled. Closing
     * the returned registration detaches the listener.
     */
    public Registration onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled()) {
            listener.run();
        }
        return () -> listeners.remove(listener);
    }

    /**
     * Blocks for {@code duration}, returning early on cancellation or when the deadline passes.
     *
     * @return true if the full duration elapsed
     */
    public boolean sleep(Duration duration) {
        Duration wait = remaining()
            .map(left -> left.compareTo(duration) < 0 ? left : duration)
            .orElse(duration);
        try {
            boolean released = cancelled.await(wait.toNanos(), TimeUnit.NANOSECONDS);
            return !released && wait.equals(duration);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancel();
            return false;
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}

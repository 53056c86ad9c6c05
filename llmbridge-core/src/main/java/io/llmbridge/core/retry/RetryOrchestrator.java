package io.llmbridge.core.retry;

import io.llmbridge.core.error.ErrorClassifier;
import io.llmbridge.core.error.ProviderException;
import io.llmbridge.core.error.ProviderFailure;
import io.llmbridge.core.error.RequestValidator;
import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.ErrorInfo;
import io.llmbridge.core.model.ErrorType;
import io.llmbridge.core.model.LlmResponse;
import io.llmbridge.core.provider.LlmProvider;
import io.llmbridge.core.provider.ProviderReply;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives attempts against one provider until success, a permanent failure, exhausted retries or
 * cancellation. Each call is sequential; one orchestrator instance is safe to share across threads.
 */
public final class RetryOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(RetryOrchestrator.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final DoubleSupplier random;

    public RetryOrchestrator() {
        this(RetryPolicy.defaults());
    }

    public RetryOrchestrator(RetryPolicy policy) {
        this(policy, Sleeper.blocking(), Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryOrchestrator(RetryPolicy policy, Sleeper sleeper, Clock clock, DoubleSupplier random) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public RetryPolicy policy() {
        return policy;
    }

    public LlmResponse execute(LlmProvider provider, CanonicalRequest request) {
        return execute(provider, request, CancellationToken.create());
    }

    public LlmResponse execute(LlmProvider provider, CanonicalRequest request, CancellationToken token) {
        Objects.requireNonNull(provider, "provider must not be null");
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(token, "token must not be null");

        Optional<ProviderFailure> violation = RequestValidator.validate(
            request,
            provider.supportsStreaming(),
            provider.supportsRouting()
        );
        if (violation.isPresent()) {
            LOG.debug("Rejected request for {} before dispatch: {}", provider.name(), violation.get().message());
            return LlmResponse.failure(ErrorClassifier.classify(violation.get()));
        }

        int maxRetries = request.maxRetries() == null ? policy.maxRetries() : request.maxRetries();
        RetryState state = RetryState.start(clock.instant());
        while (true) {
            if (token.shouldStop()) {
                return stopped(token, state);
            }

            LlmResponse response = attempt(provider, request, token);
            state = state.record(response);
            if (response.success() || !response.errorInfo().retryable()) {
                return response;
            }
            if (state.exhausted(maxRetries)) {
                LOG.warn(
                    "[{}] {} failed after {} attempt(s) in {} ms: {}",
                    Thread.currentThread().getName(),
                    provider.name(),
                    state.attempts(),
                    state.elapsed(clock.instant()).toMillis(),
                    response.errorInfo().message()
                );
                return response;
            }

            Duration delay = policy.delayFor(state.retriesUsed(), random.getAsDouble());
            LOG.warn(
                "[{}] {} request failed with retryable error ({}): {}. Waiting {} ms before retry {}/{}",
                Thread.currentThread().getName(),
                provider.name(),
                response.errorInfo().type(),
                response.errorInfo().message(),
                delay.toMillis(),
                state.attempts(),
                maxRetries
            );
            sleeper.sleep(delay, token);
        }
    }

    private LlmResponse attempt(LlmProvider provider, CanonicalRequest request, CancellationToken token) {
        try {
            ProviderReply reply = provider.execute(request, token);
            return LlmResponse.success(reply.response(), reply.raw());
        } catch (ProviderException e) {
            return LlmResponse.failure(ErrorClassifier.classify(e.failure()), e.rawResponse());
        } catch (RuntimeException e) {
            LOG.error("Provider {} raised an unexpected error", provider.name(), e);
            return LlmResponse.failure(ErrorInfo.of(ErrorType.UNKNOWN, "Unexpected error: " + e.getMessage()));
        }
    }

    private LlmResponse stopped(CancellationToken token, RetryState state) {
        if (token.isCancelled()) {
            return LlmResponse.failure(ErrorInfo.of(
                ErrorType.CANCELLED,
                "Request cancelled after " + state.attempts() + " attempt(s)"
            ));
        }
        ErrorInfo last = state.lastResponse() == null ? null : state.lastResponse().errorInfo();
        String detail = last == null ? "" : " (last error: " + last.message() + ")";
        return LlmResponse.failure(new ErrorInfo(
            ErrorType.TIMEOUT,
            "Deadline exceeded after " + state.attempts() + " attempt(s)" + detail,
            false,
            last == null ? null : last.statusCode()
        ));
    }
}

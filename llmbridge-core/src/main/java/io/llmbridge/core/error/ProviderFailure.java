package io.llmbridge.core.error;

import java.util.Objects;

/**
 * What went wrong during one attempt, before any retry decision is made. Classification into an
 * {@link io.llmbridge.core.model.ErrorInfo} is the job of {@link ErrorClassifier}.
 */
public record ProviderFailure(FailureKind kind, Integer statusCode, String message) {

    public ProviderFailure {
        Objects.requireNonNull(kind, "kind must not be null");
        message = message == null ? "" : message;
    }

    public static ProviderFailure of(FailureKind kind, String message) {
        return new ProviderFailure(kind, null, message);
    }

    public static ProviderFailure httpStatus(int statusCode, String message) {
        return new ProviderFailure(FailureKind.HTTP_STATUS, statusCode, message);
    }

    public static ProviderFailure contractViolation(String message) {
        return of(FailureKind.CONTRACT_VIOLATION, message);
    }
}

package io.llmbridge.core.model;

import java.util.Objects;

public record ErrorInfo(ErrorType type, String message, boolean retryable, Integer statusCode) {

    public ErrorInfo {
        Objects.requireNonNull(type, "type must not be null");
        message = message == null ? "" : message;
    }

    public static ErrorInfo of(ErrorType type, String message) {
        return new ErrorInfo(type, message, type.retryable(), null);
    }

    public static ErrorInfo of(ErrorType type, String message, Integer statusCode) {
        return new ErrorInfo(type, message, type.retryable(), statusCode);
    }

    public static ErrorInfo invalidOption(String message) {
        return of(ErrorType.INVALID_OPTION, message);
    }
}

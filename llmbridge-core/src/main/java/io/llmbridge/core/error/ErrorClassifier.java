package io.llmbridge.core.error;

import com.fasterxml.jackson.databind.JsonNode;
import io.llmbridge.core.model.ErrorInfo;
import io.llmbridge.core.model.ErrorType;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Set;
import javax.net.ssl.SSLException;

/**
 * Single source of truth for the retryable/permanent split. Pure and deterministic: the same
 * failure always yields the same {@link ErrorInfo}.
 */
public final class ErrorClassifier {
    private static final Set<Integer> SERVER_ERRORS = Set.of(500, 502, 503, 504);
    private static final Set<Integer> AUTH_ERRORS = Set.of(401, 403);
    private static final Set<Integer> REQUEST_ERRORS = Set.of(400, 422);

    private ErrorClassifier() {
    }

    /**
     * Reads the HTTP-like status from an in-body {@code error} object. Providers send it either as
     * a number or as a three-digit string.
     */
    public static Integer statusCodeOf(JsonNode error) {
        JsonNode code = error == null ? null : error.path("code");
        if (code == null) {
            return null;
        }
        if (code.isInt()) {
            return code.intValue();
        }
        if (code.isTextual() && code.asText().trim().matches("\\d{3}")) {
            return Integer.parseInt(code.asText().trim());
        }
        return null;
    }

    public static ErrorInfo classify(ProviderFailure failure) {
        Integer status = failure.statusCode();
        String message = failure.message();
        return switch (failure.kind()) {
            case CONNECTION -> ErrorInfo.of(ErrorType.NETWORK, message, status);
            case TIMEOUT -> ErrorInfo.of(ErrorType.TIMEOUT, message, status);
            case HTTP_STATUS -> byStatus(status, message, ErrorType.UNKNOWN);
            case BODY_ERROR -> byStatus(status, message, ErrorType.INVALID_REQUEST);
            case CONTRACT_VIOLATION -> ErrorInfo.of(ErrorType.INVALID_OPTION, message, status);
            case MISSING_CREDENTIAL -> ErrorInfo.of(ErrorType.AUTH, message, status);
            case CONTENT_FILTER -> ErrorInfo.of(ErrorType.CONTENT_FILTER, message, status);
            case CANCELLED -> ErrorInfo.of(ErrorType.CANCELLED, message, status);
            case STREAM_INCOMPLETE, OTHER -> ErrorInfo.of(ErrorType.UNKNOWN, message, status);
        };
    }

    public static ProviderFailure failureOf(IOException exception) {
        String message = describe(exception);
        if (isTimeout(exception)) {
            return ProviderFailure.of(FailureKind.TIMEOUT, message);
        }
        return ProviderFailure.of(FailureKind.CONNECTION, message);
    }

    private static ErrorInfo byStatus(Integer status, String message, ErrorType fallback) {
        if (status == null) {
            return ErrorInfo.of(fallback, message);
        }
        if (status == 429) {
            return ErrorInfo.of(ErrorType.RATE_LIMIT, message, status);
        }
        if (SERVER_ERRORS.contains(status)) {
            return ErrorInfo.of(ErrorType.SERVER_ERROR, message, status);
        }
        if (AUTH_ERRORS.contains(status)) {
            return ErrorInfo.of(ErrorType.AUTH, message, status);
        }
        if (REQUEST_ERRORS.contains(status)) {
            return ErrorInfo.of(ErrorType.INVALID_REQUEST, message, status);
        }
        if (status == 408) {
            return ErrorInfo.of(ErrorType.TIMEOUT, message, status);
        }
        return ErrorInfo.of(fallback, message, status);
    }

    private static boolean isTimeout(IOException exception) {
        if (exception instanceof SocketTimeoutException) {
            return true;
        }
        if (exception instanceof UnknownHostException
            || exception instanceof ConnectException
            || exception instanceof NoRouteToHostException
            || exception instanceof SSLException) {
            return false;
        }
        if (exception instanceof InterruptedIOException) {
            String text = exception.getMessage() == null ? "" : exception.getMessage().toLowerCase(Locale.ROOT);
            return text.contains("timeout") || text.contains("timed out");
        }
        return false;
    }

    private static String describe(IOException exception) {
        String text = exception.getMessage();
        String type = exception.getClass().getSimpleName();
        return text == null || text.isBlank() ? type : type + ": " + text;
    }
}

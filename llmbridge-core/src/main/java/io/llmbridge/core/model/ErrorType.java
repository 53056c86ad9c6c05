package io.llmbridge.core.model;

public enum ErrorType {
    NETWORK("network", true),
    TIMEOUT("timeout", true),
    RATE_LIMIT("rate_limit", true),
    SERVER_ERROR("server_error", true),
    AUTH("auth", false),
    INVALID_REQUEST("invalid_request", false),
    INVALID_OPTION("invalid_option", false),
    CONTENT_FILTER("content_filter", false),
    CANCELLED("cancelled", false),
    UNKNOWN("unknown", false);

    private final String tag;
    private final boolean retryable;

    ErrorType(String tag, boolean retryable) {
        this.tag = tag;
        this.retryable = retryable;
    }

    public String tag() {
        return tag;
    }

    public boolean retryable() {
        return retryable;
    }

    @Override
    public String toString() {
        return tag;
    }
}

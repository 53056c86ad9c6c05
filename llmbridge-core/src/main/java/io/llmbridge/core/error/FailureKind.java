package io.llmbridge.core.error;

public enum FailureKind {
    CONNECTION,
    TIMEOUT,
    HTTP_STATUS,
    BODY_ERROR,
    CONTENT_FILTER,
    CONTRACT_VIOLATION,
    MISSING_CREDENTIAL,
    STREAM_INCOMPLETE,
    CANCELLED,
    OTHER
}

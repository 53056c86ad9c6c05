package io.llmbridge.core.coherency;

public class CoherencyException extends RuntimeException {

    public CoherencyException(String message) {
        super(message);
    }

    public CoherencyException(String message, Throwable cause) {
        super(message, cause);
    }
}

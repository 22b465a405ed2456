package com.example.fileorganizer.exception;

import java.time.Duration;

/**
 * Thrown when the classification of a single file exceeds its time budget.
 *
 * <p>Unchecked so the timeout wrapper can be placed around any callable. The driver
 * converts it into a {@code TIMED_OUT} outcome for that file only.
 */
public class ClassificationTimeoutException extends RuntimeException {
    private final String operation;
    private final Duration timeout;

    public ClassificationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(String.format("Operation '%s' timed out after %d ms", operation, timeout.toMillis()), cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}

package com.example.fileorganizer.exception;

/**
 * Raised when a chat backend is unreachable, times out, or answers with something unusable.
 * Callers treat it as a recoverable degradation.
 */
public class BackendException extends Exception {
    private final String backend;

    public BackendException(String backend, String message) {
        super(backend + ": " + message);
        this.backend = backend;
    }

    public BackendException(String backend, String message, Throwable cause) {
        super(backend + ": " + message, cause);
        this.backend = backend;
    }

    /**
     * Returns the name of the backend (or chain) that failed.
     */
    public String getBackend() {
        return backend;
    }
}

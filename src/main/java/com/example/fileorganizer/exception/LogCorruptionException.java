package com.example.fileorganizer.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when a session document or the result store exists but cannot be parsed.
 * Writers refuse to replace such a file.
 */
public class LogCorruptionException extends IOException {
    private final transient Path document;

    public LogCorruptionException(Path document, String message) {
        super(document + ": " + message);
        this.document = document;
    }

    public LogCorruptionException(Path document, String message, Throwable cause) {
        super(document + ": " + message, cause);
        this.document = document;
    }

    public Path getDocument() {
        return document;
    }
}

package com.example.fileorganizer.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when no free file name could be found in a target directory.
 */
public class CollisionException extends IOException {
    private final transient Path targetDirectory;
    private final String fileName;
    private final int attempts;

    public CollisionException(Path targetDirectory, String fileName, int attempts) {
        super(String.format("No free name for '%s' in %s after %d attempts", fileName, targetDirectory, attempts));
        this.targetDirectory = targetDirectory;
        this.fileName = fileName;
        this.attempts = attempts;
    }

    public Path getTargetDirectory() {
        return targetDirectory;
    }

    public String getFileName() {
        return fileName;
    }

    public int getAttempts() {
        return attempts;
    }
}

package com.example.fileorganizer;

public interface ProcessingLimiter {
    /**
     * Returns true if no further file should be started once {@code startedCount} files
     * have been started.
     */
    boolean shouldStop(long startedCount);

    /**
     * Default limiter used in production runs (never stops early).
     */
    ProcessingLimiter NO_LIMIT = startedCount -> false;

    static ProcessingLimiter maxFiles(long limit) {
        return startedCount -> startedCount >= limit;
    }
}

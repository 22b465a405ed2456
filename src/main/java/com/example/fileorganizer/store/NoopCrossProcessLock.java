package com.example.fileorganizer.store;

import java.nio.file.Path;

/**
 * Used where the platform has no usable file locks; only in-process locking remains.
 */
public class NoopCrossProcessLock implements CrossProcessLock {
    private static final Handle RELEASED = () -> {
    };

    @Override
    public Handle acquire(Path lockFile) {
        return RELEASED;
    }
}

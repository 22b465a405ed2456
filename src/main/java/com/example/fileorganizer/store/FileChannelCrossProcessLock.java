package com.example.fileorganizer.store;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive {@link FileLock} on a sibling lock file. Callers must serialize threads of the
 * same JVM themselves, the OS lock is held per process.
 */
public class FileChannelCrossProcessLock implements CrossProcessLock {

    @Override
    public Handle acquire(Path lockFile) throws IOException {
        FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = channel.lock();
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
        return () -> {
            try {
                lock.release();
            } finally {
                channel.close();
            }
        };
    }
}

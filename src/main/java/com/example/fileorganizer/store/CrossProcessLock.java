package com.example.fileorganizer.store;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Advisory lock shared with other processes writing the same store.
 */
public interface CrossProcessLock {

    Handle acquire(Path lockFile) throws IOException;

    interface Handle extends AutoCloseable {
        @Override
        void close() throws IOException;
    }
}

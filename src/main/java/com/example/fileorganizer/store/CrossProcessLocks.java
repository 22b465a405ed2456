package com.example.fileorganizer.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Picks the cross-process lock implementation once, by probing file locking in the
 * temporary directory.
 */
public final class CrossProcessLocks {
    private static final Logger LOGGER = LoggerFactory.getLogger(CrossProcessLocks.class);

    private CrossProcessLocks() {
    }

    public static CrossProcessLock platformDefault() {
        return Holder.INSTANCE;
    }

    static CrossProcessLock probe(Path directory) {
        FileChannelCrossProcessLock candidate = new FileChannelCrossProcessLock();
        Path probe = null;
        try {
            probe = Files.createTempFile(directory, "lock-probe", ".lock");
            candidate.acquire(probe).close();
            return candidate;
        } catch (IOException | UnsupportedOperationException e) {
            LOGGER.warn("File locks are not supported here ({}); result store writes are only "
                    + "serialized within this process", e.getMessage());
            return new NoopCrossProcessLock();
        } finally {
            if (probe != null) {
                try {
                    Files.deleteIfExists(probe);
                } catch (IOException e) {
                    LOGGER.debug("Could not delete lock probe {}: {}", probe, e.getMessage());
                }
            }
        }
    }

    private static final class Holder {
        private static final CrossProcessLock INSTANCE = probe(Path.of(System.getProperty("java.io.tmpdir")));
    }
}

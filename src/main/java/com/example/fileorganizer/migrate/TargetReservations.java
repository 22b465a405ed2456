package com.example.fileorganizer.migrate;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Target paths chosen but not yet written. Keeps two workers (or two items of one dry run)
 * from picking the same free name.
 */
public final class TargetReservations {
    private final Set<Path> reserved = ConcurrentHashMap.newKeySet();

    public boolean reserve(Path target) {
        return reserved.add(key(target));
    }

    public boolean isReserved(Path target) {
        return reserved.contains(key(target));
    }

    public void release(Path target) {
        reserved.remove(key(target));
    }

    public int size() {
        return reserved.size();
    }

    private Path key(Path target) {
        return target.toAbsolutePath().normalize();
    }
}

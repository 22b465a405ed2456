package com.example.fileorganizer.classify;

import com.example.fileorganizer.model.FileRecord;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run registry of the contexts of files currently in flight, keyed by source path.
 */
public final class ClassificationContexts {
    private final ConcurrentHashMap<Path, ClassificationContext> contexts = new ConcurrentHashMap<>();

    public ClassificationContext open(FileRecord file) {
        return contexts.computeIfAbsent(key(file.toPath()), ignored -> new ClassificationContext(file));
    }

    public Optional<ClassificationContext> get(Path file) {
        return Optional.ofNullable(contexts.get(key(file)));
    }

    /**
     * Drops the context of a file whose processing has ended.
     */
    public void discard(Path file) {
        ClassificationContext removed = contexts.remove(key(file));
        if (removed != null) {
            removed.clear();
        }
    }

    public int size() {
        return contexts.size();
    }

    private Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }
}

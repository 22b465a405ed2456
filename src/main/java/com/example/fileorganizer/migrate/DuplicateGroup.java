package com.example.fileorganizer.migrate;

import java.nio.file.Path;
import java.util.List;

/**
 * Files with identical content; {@code kept} is the one with the earliest creation time.
 */
public record DuplicateGroup(String hash, long size, Path kept, List<Path> duplicates) {
    public DuplicateGroup {
        duplicates = List.copyOf(duplicates);
    }
}

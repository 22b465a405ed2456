package com.example.fileorganizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;

/**
 * Attributes of one source file captured at scan time.
 */
public record FileRecord(
        String path,
        String name,
        String extension,
        long size,
        Instant createdTime,
        Instant modifiedTime
) {
    @JsonIgnore
    public Path toPath() {
        return Path.of(path);
    }

    /**
     * Returns the lower-case extension including the dot, or an empty string.
     */
    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}

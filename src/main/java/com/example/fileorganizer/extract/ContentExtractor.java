package com.example.fileorganizer.extract;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Best-effort plain text extraction.
 */
@FunctionalInterface
public interface ContentExtractor {
    /**
     * Returns at most {@code maxLength} characters of the file's text, or an empty string
     * when the format carries no extractable text.
     */
    String extract(Path path, int maxLength) throws IOException;

    static ContentExtractor none() {
        return (path, maxLength) -> "";
    }
}

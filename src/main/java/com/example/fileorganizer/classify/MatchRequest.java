package com.example.fileorganizer.classify;

import java.nio.file.Path;
import java.util.List;

/**
 * The candidates of one level together with the file being placed.
 */
public record MatchRequest(
        ClassificationContext context,
        List<String> candidates,
        int level,
        Path directory
) {
    public MatchRequest {
        candidates = List.copyOf(candidates);
    }

    public String fileName() {
        return context.file().name();
    }
}

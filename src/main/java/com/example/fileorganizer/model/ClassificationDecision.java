package com.example.fileorganizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of classifying one file against a target tree.
 *
 * <p>{@code relativePath} joins the level tags with {@code /}; it is empty when nothing
 * matched. Partial matches count as success and keep their deepest matched prefix.
 */
public record ClassificationDecision(
        List<String> levelTags,
        String relativePath,
        String reason,
        boolean success,
        ClassificationStatus status,
        String summary,
        boolean backendDegraded
) {
    public ClassificationDecision {
        levelTags = List.copyOf(levelTags);
    }

    public static ClassificationDecision of(List<String> levelTags,
                                            String reason,
                                            ClassificationStatus status,
                                            String summary,
                                            boolean backendDegraded) {
        return new ClassificationDecision(
                levelTags,
                String.join("/", levelTags),
                reason,
                status != ClassificationStatus.UNMATCHED,
                status,
                summary == null ? "" : summary,
                backendDegraded
        );
    }

    /**
     * Resolves the matched directory under the given target root.
     */
    public Path resolveAgainst(Path targetRoot) {
        Path resolved = targetRoot;
        for (String tag : levelTags) {
            resolved = resolved.resolve(tag);
        }
        return resolved;
    }

    @JsonIgnore
    public boolean isPartial() {
        return status == ClassificationStatus.PARTIAL;
    }
}

package com.example.fileorganizer;

import com.example.fileorganizer.backend.BackendEndpoint;
import com.example.fileorganizer.transferlog.OperationKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Immutable runtime settings for the organizer.
 */
public record OrganizerConfig(
        List<Path> sourceDirectories,
        Optional<Path> targetDirectory,
        Path outputDirectory,
        Path transferLogDirectory,
        Path resultStoreFile,
        Optional<Path> classificationRulesFile,
        OperationKind operation,
        int threadCount,
        Duration fileTimeout,
        int contentExtractionLength,
        int summaryLength,
        int maxDepth,
        int backendRetryAttempts,
        Duration backendRetryBackoff,
        Duration backendRequestTimeout,
        boolean followLinks,
        Optional<Integer> maxFiles,
        List<String> excludeFilePatterns,
        List<String> excludeDirectoryPatterns,
        List<BackendEndpoint> backends
) {
}

package com.example.fileorganizer.migrate;

import com.example.fileorganizer.model.FailureKind;

import java.nio.file.Path;

/**
 * @param target      the chosen target path, null when none could be chosen
 * @param renamed     true when a collision suffix was applied
 * @param operationId the transfer log id of the operation, null in dry runs or when nothing was logged
 */
public record MigrationResult(
        Path source,
        Path target,
        boolean success,
        boolean renamed,
        String error,
        FailureKind failureKind,
        Long operationId
) {
    static MigrationResult succeeded(Path source, Path target, boolean renamed, Long operationId) {
        return new MigrationResult(source, target, true, renamed, null, null, operationId);
    }

    static MigrationResult failed(Path source, Path target, FailureKind kind, String error) {
        return new MigrationResult(source, target, false, false, error, kind, null);
    }
}

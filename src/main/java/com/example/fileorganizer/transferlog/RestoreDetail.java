package com.example.fileorganizer.transferlog;

/**
 * Outcome of undoing one logged operation. {@code operationId} is null for an interrupted
 * operation that only left an intent behind.
 */
public record RestoreDetail(
        Long operationId,
        String intentId,
        OperationKind kind,
        String sourcePath,
        String targetPath,
        RestoreStatus status,
        String message
) {
}

package com.example.fileorganizer.transferlog;

import java.time.Instant;

/**
 * What the caller knows about a finished filesystem operation; the log adds id and time.
 */
public record TransferRequest(
        OperationKind kind,
        String sourcePath,
        String targetPath,
        String targetFolder,
        boolean success,
        String errorMessage,
        long fileSize,
        String fileHash,
        Instant createdTime
) {
    public static TransferRequest succeeded(OperationKind kind, String source, String target, String targetFolder,
                                            long fileSize, String fileHash, Instant createdTime) {
        return new TransferRequest(kind, source, target, targetFolder, true, null, fileSize, fileHash, createdTime);
    }

    public static TransferRequest failed(OperationKind kind, String source, String target, String targetFolder,
                                         long fileSize, String errorMessage) {
        return new TransferRequest(kind, source, target, targetFolder, false, errorMessage, fileSize, null, null);
    }
}

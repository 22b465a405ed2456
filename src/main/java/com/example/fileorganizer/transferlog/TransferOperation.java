package com.example.fileorganizer.transferlog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One appended entry of a session document.
 */
public record TransferOperation(
        @JsonProperty("operation_id") long operationId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("operation_type") OperationKind kind,
        @JsonProperty("source_path") String sourcePath,
        @JsonProperty("target_path") String targetPath,
        @JsonProperty("target_folder") String targetFolder,
        @JsonProperty("file_size") long fileSize,
        @JsonProperty("file_hash") String fileHash,
        @JsonProperty("ctime") Instant createdTime,
        @JsonProperty("success") boolean success,
        @JsonProperty("error_message") String errorMessage
) {
    static TransferOperation from(long id, Instant timestamp, TransferRequest request) {
        return new TransferOperation(
                id,
                timestamp,
                request.kind(),
                request.sourcePath(),
                request.targetPath(),
                request.targetFolder(),
                request.fileSize(),
                request.fileHash(),
                request.createdTime(),
                request.success(),
                request.errorMessage()
        );
    }
}

package com.example.fileorganizer.transferlog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Write-ahead record of a filesystem operation that is about to start. Removed by the
 * append that reports its outcome; one still present after a crash marks an interrupted
 * operation.
 */
public record PendingTransfer(
        @JsonProperty("intent_id") String intentId,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("operation_type") OperationKind kind,
        @JsonProperty("source_path") String sourcePath,
        @JsonProperty("target_path") String targetPath
) {
}

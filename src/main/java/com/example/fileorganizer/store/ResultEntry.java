package com.example.fileorganizer.store;

import com.example.fileorganizer.model.ClassificationStatus;
import com.example.fileorganizer.model.FileRecord;
import com.example.fileorganizer.model.TimingBreakdown;
import com.example.fileorganizer.transferlog.OperationKind;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * One processed file as kept in the result store. Unique by file name and final target path.
 */
public record ResultEntry(
        String fileName,
        String sourcePath,
        String targetFolder,
        String finalTargetPath,
        List<String> levelTags,
        String matchReason,
        String summary,
        ClassificationStatus classificationStatus,
        OperationKind operation,
        ProcessingStatus status,
        boolean success,
        String errorMessage,
        TimingBreakdown timings,
        long processingTimeMillis,
        Instant processedAt,
        FileRecord metadata
) {
    public ResultEntry {
        levelTags = levelTags == null ? List.of() : List.copyOf(levelTags);
    }

    /**
     * File name plus final target path. Entries without a target (failed files) fall back
     * to the source path so unrelated failures with the same name stay distinct.
     */
    @JsonIgnore
    public DedupKey dedupKey() {
        String location = finalTargetPath == null || finalTargetPath.isEmpty() ? sourcePath : finalTargetPath;
        return new DedupKey(fileName, location == null ? "" : location);
    }

    public record DedupKey(String fileName, String finalTargetPath) {
    }
}

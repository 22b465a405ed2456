package com.example.fileorganizer;

import com.example.fileorganizer.model.ClassificationDecision;
import com.example.fileorganizer.model.FailureKind;
import com.example.fileorganizer.model.FileRecord;
import com.example.fileorganizer.model.TimingBreakdown;
import com.example.fileorganizer.store.ProcessingStatus;

import java.nio.file.Path;

/**
 * What happened to one input file during an organize run.
 *
 * @param decision    null when classification did not finish
 * @param finalTarget null unless a target was chosen
 */
public record FileOutcome(
        FileRecord file,
        ProcessingStatus status,
        FailureKind failureKind,
        String message,
        ClassificationDecision decision,
        Path finalTarget,
        boolean renamed,
        TimingBreakdown timings
) {
    public boolean isSuccess() {
        return status == ProcessingStatus.MIGRATED || status == ProcessingStatus.PLANNED;
    }

    public long processingTimeMillis() {
        return timings == null ? 0 : timings.totalMillis();
    }

    static FileOutcome skipped(FileRecord file) {
        return new FileOutcome(file, ProcessingStatus.SKIPPED, null, "run stopped before this file",
                null, null, false, TimingBreakdown.NONE);
    }

    static FileOutcome duplicate(FileRecord file) {
        return new FileOutcome(file, ProcessingStatus.SKIPPED, null, "duplicate of an earlier input",
                null, null, false, TimingBreakdown.NONE);
    }

    static FileOutcome failed(FileRecord file, FailureKind kind, String message, long elapsedMillis) {
        return new FileOutcome(file, ProcessingStatus.FAILED, kind, message, null, null, false,
                new TimingBreakdown(0, 0, 0, 0, elapsedMillis));
    }
}

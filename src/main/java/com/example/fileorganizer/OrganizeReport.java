package com.example.fileorganizer;

import com.example.fileorganizer.store.ProcessingStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * One outcome per input file, in input order.
 */
public record OrganizeReport(
        Path targetRoot,
        boolean dryRun,
        String sessionName,
        List<FileOutcome> outcomes,
        long elapsedMillis
) {
    public OrganizeReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(ProcessingStatus status) {
        return outcomes.stream().filter(outcome -> outcome.status() == status).count();
    }

    public long successCount() {
        return outcomes.stream().filter(FileOutcome::isSuccess).count();
    }

    public long failureCount() {
        return count(ProcessingStatus.FAILED) + count(ProcessingStatus.TIMED_OUT);
    }
}

package com.example.fileorganizer.store;

public enum ProcessingStatus {
    /** Copied or moved into the target tree. */
    MIGRATED,
    /** Dry run: classified and a target chosen, nothing written. */
    PLANNED,
    FAILED,
    TIMED_OUT,
    /** Not started because the run was stopped; never stored. */
    SKIPPED
}

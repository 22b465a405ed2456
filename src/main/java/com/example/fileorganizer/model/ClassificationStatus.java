package com.example.fileorganizer.model;

/**
 * How far down the target tree a file could be classified.
 */
public enum ClassificationStatus {
    /** A leaf directory, or the depth cap, was reached. */
    COMPLETE,
    /** At least one level matched, but a deeper level with sub-directories did not. */
    PARTIAL,
    /** No directory matched at the first level. */
    UNMATCHED
}

package com.example.fileorganizer.model;

/**
 * Milliseconds spent per processing stage of one file.
 */
public record TimingBreakdown(
        long metadataMillis,
        long contentExtractionMillis,
        long summaryMillis,
        long recommendationMillis,
        long totalMillis
) {
    public static final TimingBreakdown NONE = new TimingBreakdown(0, 0, 0, 0, 0);
}

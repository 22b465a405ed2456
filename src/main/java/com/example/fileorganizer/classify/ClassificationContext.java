package com.example.fileorganizer.classify;

import com.example.fileorganizer.model.FileRecord;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything learned about one file while it is being classified: extracted content,
 * summary, level tags and stage timings. Lives only until the file has been processed.
 */
public final class ClassificationContext {

    public enum Stage {
        METADATA,
        CONTENT_EXTRACTION,
        SUMMARY,
        RECOMMENDATION
    }

    private final FileRecord file;
    private final Map<Stage, Long> timings = new EnumMap<>(Stage.class);
    private final List<String> levelTags = new ArrayList<>();
    private String content;
    private String summary;
    private String degradationReason;

    public ClassificationContext(FileRecord file) {
        this.file = file;
    }

    public FileRecord file() {
        return file;
    }

    public synchronized boolean hasContent() {
        return content != null;
    }

    public synchronized String content() {
        return content == null ? "" : content;
    }

    synchronized void setContent(String content) {
        this.content = content == null ? "" : content;
    }

    public synchronized boolean hasSummary() {
        return summary != null;
    }

    /**
     * Returns the summary if one was generated, otherwise an empty string.
     */
    public synchronized String summary() {
        return summary == null ? "" : summary;
    }

    synchronized void setSummary(String summary) {
        this.summary = summary == null ? "" : summary;
    }

    public synchronized boolean backendDegraded() {
        return degradationReason != null;
    }

    public synchronized String degradationReason() {
        return degradationReason;
    }

    synchronized void markBackendDegraded(String reason) {
        if (degradationReason == null) {
            degradationReason = reason;
        }
    }

    public synchronized List<String> levelTags() {
        return List.copyOf(levelTags);
    }

    synchronized void setLevelTags(List<String> tags) {
        levelTags.clear();
        levelTags.addAll(tags);
    }

    public synchronized void recordTiming(Stage stage, long millis) {
        timings.merge(stage, millis, Long::sum);
    }

    public synchronized long timing(Stage stage) {
        return timings.getOrDefault(stage, 0L);
    }

    synchronized void clear() {
        content = null;
        summary = null;
        levelTags.clear();
        timings.clear();
    }
}

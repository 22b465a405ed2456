package com.example.fileorganizer.migrate;

import java.nio.file.Path;
import java.util.List;

public record DuplicateReport(
        Path folder,
        boolean dryRun,
        int filesScanned,
        List<DuplicateGroup> groups,
        List<Path> deleted,
        List<String> errors,
        String sessionName
) {
    public DuplicateReport {
        groups = List.copyOf(groups);
        deleted = List.copyOf(deleted);
        errors = List.copyOf(errors);
    }

    public int duplicatesFound() {
        return groups.stream().mapToInt(group -> group.duplicates().size()).sum();
    }

    public long bytesReclaimable() {
        return groups.stream().mapToLong(group -> group.size() * group.duplicates().size()).sum();
    }
}

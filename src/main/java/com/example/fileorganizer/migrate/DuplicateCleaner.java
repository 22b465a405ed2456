package com.example.fileorganizer.migrate;

import com.example.fileorganizer.extract.FileHasher;
import com.example.fileorganizer.transferlog.OperationKind;
import com.example.fileorganizer.transferlog.PendingTransfer;
import com.example.fileorganizer.transferlog.TransferLog;
import com.example.fileorganizer.transferlog.TransferRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Removes files whose content duplicates another file in the same folder tree. Candidates
 * are grouped by size, then by SHA-256; the earliest created file of each group is kept.
 * Every deletion is journaled as {@code delete_duplicate} with the kept file as its target,
 * so restore can copy it back.
 */
public class DuplicateCleaner {
    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateCleaner.class);

    private final TransferLog transferLog;

    public DuplicateCleaner(TransferLog transferLog) {
        this.transferLog = transferLog;
    }

    public DuplicateReport removeDuplicates(Path folder, boolean dryRun) throws IOException {
        if (!Files.isDirectory(folder)) {
            throw new NoSuchFileException(folder.toString(), null, "not a directory");
        }
        List<String> errors = new ArrayList<>();
        List<ScannedFile> files = scan(folder, errors);
        List<DuplicateGroup> groups = findGroups(files, errors);

        List<Path> deleted = new ArrayList<>();
        String sessionName = null;
        if (!dryRun && !groups.isEmpty()) {
            boolean ownSession = !transferLog.isOpen();
            if (ownSession) {
                transferLog.start(transferLog.timestampedName("dedup_" + folder.getFileName()));
            }
            sessionName = transferLog.current().map(handle -> handle.name()).orElse(null);
            try {
                for (DuplicateGroup group : groups) {
                    for (Path duplicate : group.duplicates()) {
                        delete(group, duplicate, deleted, errors);
                    }
                }
            } finally {
                if (ownSession) {
                    transferLog.end();
                }
            }
        }

        DuplicateReport report = new DuplicateReport(folder, dryRun, files.size(), groups, deleted, errors, sessionName);
        LOGGER.info("Duplicate scan of {}{}: {} files, {} groups, {} duplicates, {} deleted, {} errors",
                folder, dryRun ? " (dry run)" : "", files.size(), groups.size(),
                report.duplicatesFound(), deleted.size(), errors.size());
        return report;
    }

    private void delete(DuplicateGroup group, Path duplicate, List<Path> deleted, List<String> errors) {
        PendingTransfer intent;
        try {
            intent = transferLog.recordIntent(OperationKind.DELETE_DUPLICATE, duplicate.toString(), group.kept().toString());
        } catch (IOException e) {
            errors.add(duplicate + ": write-ahead entry failed: " + e.getMessage());
            LOGGER.error("Not deleting {}, write-ahead entry failed", duplicate, e);
            return;
        }
        Instant created = null;
        try {
            created = Files.readAttributes(duplicate, BasicFileAttributes.class).creationTime().toInstant();
            Files.delete(duplicate);
        } catch (IOException e) {
            errors.add(duplicate + ": " + e.getMessage());
            LOGGER.error("Failed to delete duplicate {}", duplicate, e);
            appendQuietly(TransferRequest.failed(OperationKind.DELETE_DUPLICATE, duplicate.toString(),
                    group.kept().toString(), "", group.size(), e.getMessage()), intent);
            return;
        }
        deleted.add(duplicate);
        LOGGER.info("Deleted duplicate {} (kept {})", duplicate, group.kept());
        appendQuietly(TransferRequest.succeeded(OperationKind.DELETE_DUPLICATE, duplicate.toString(),
                group.kept().toString(), "", group.size(), group.hash(), created), intent);
    }

    private void appendQuietly(TransferRequest request, PendingTransfer intent) {
        try {
            transferLog.append(request, intent.intentId());
        } catch (IOException e) {
            LOGGER.error("Could not log {} of {}; intent {} stays pending",
                    request.kind().id(), request.sourcePath(), intent.intentId(), e);
        }
    }

    private List<ScannedFile> scan(Path folder, List<String> errors) throws IOException {
        List<ScannedFile> files = new ArrayList<>();
        Files.walkFileTree(folder, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    files.add(new ScannedFile(file, attrs.size(), attrs.creationTime().toInstant()));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LOGGER.warn("Cannot read {}: {}", file, exc.getMessage());
                errors.add(file + ": " + exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    private List<DuplicateGroup> findGroups(List<ScannedFile> files, List<String> errors) {
        Map<Long, List<ScannedFile>> bySize = new TreeMap<>();
        for (ScannedFile file : files) {
            bySize.computeIfAbsent(file.size(), ignored -> new ArrayList<>()).add(file);
        }
        List<DuplicateGroup> groups = new ArrayList<>();
        for (Map.Entry<Long, List<ScannedFile>> sameSize : bySize.entrySet()) {
            if (sameSize.getValue().size() < 2) {
                continue;
            }
            Map<String, List<ScannedFile>> byHash = new LinkedHashMap<>();
            for (ScannedFile file : sameSize.getValue()) {
                try {
                    byHash.computeIfAbsent(FileHasher.sha256(file.path()), ignored -> new ArrayList<>()).add(file);
                } catch (IOException e) {
                    LOGGER.warn("Cannot hash {}: {}", file.path(), e.getMessage());
                    errors.add(file.path() + ": " + e.getMessage());
                }
            }
            for (Map.Entry<String, List<ScannedFile>> sameHash : byHash.entrySet()) {
                List<ScannedFile> members = sameHash.getValue();
                if (members.size() < 2) {
                    continue;
                }
                members.sort(Comparator.comparing(ScannedFile::createdTime).thenComparing(ScannedFile::path));
                List<Path> duplicates = new ArrayList<>();
                for (ScannedFile member : members.subList(1, members.size())) {
                    duplicates.add(member.path());
                }
                groups.add(new DuplicateGroup(sameHash.getKey(), sameSize.getKey(), members.get(0).path(), duplicates));
            }
        }
        return groups;
    }

    private record ScannedFile(Path path, long size, Instant createdTime) {
    }
}

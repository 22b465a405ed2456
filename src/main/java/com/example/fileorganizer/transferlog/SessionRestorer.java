package com.example.fileorganizer.transferlog;

import com.example.fileorganizer.extract.FileHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Replays the inverse of logged operations. Never overwrites a file that already exists at
 * the original source location.
 */
class SessionRestorer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRestorer.class);
    static final String TARGET_MISSING = "target missing";

    RestoreReport restore(TransferSession session, Collection<Long> operationIds, boolean dryRun) {
        boolean selectAll = operationIds == null || operationIds.isEmpty();
        List<RestoreDetail> details = new ArrayList<>();

        // newest first so chained operations unwind in order
        List<TransferOperation> operations = new ArrayList<>(session.operations());
        for (int i = operations.size() - 1; i >= 0; i--) {
            TransferOperation operation = operations.get(i);
            if (!operation.success()) {
                continue;
            }
            if (!selectAll && !operationIds.contains(operation.operationId())) {
                continue;
            }
            details.add(undo(operation.operationId(), null, operation.kind(),
                    operation.sourcePath(), operation.targetPath(),
                    operation.fileHash(), operation.createdTime(), dryRun));
        }
        if (selectAll) {
            for (PendingTransfer intent : session.pending()) {
                LOGGER.warn("Session {} has an interrupted {} of {}",
                        session.info().sessionName(), intent.kind().id(), intent.sourcePath());
                details.add(undo(null, intent.intentId(), intent.kind(),
                        intent.sourcePath(), intent.targetPath(), null, null, dryRun));
            }
        }

        RestoreReport report = new RestoreReport(session.info().sessionName(), dryRun, details);
        LOGGER.info("Restore of {}{}: {} restored, {} would restore, {} intact, {} skipped, {} failed",
                report.sessionName(), dryRun ? " (dry run)" : "",
                report.count(RestoreStatus.RESTORED), report.count(RestoreStatus.WOULD_RESTORE),
                report.count(RestoreStatus.ALREADY_INTACT), report.count(RestoreStatus.SKIPPED),
                report.count(RestoreStatus.FAILED));
        return report;
    }

    private RestoreDetail undo(Long operationId, String intentId, OperationKind kind,
                               String sourcePath, String targetPath, String expectedHash,
                               Instant createdTime, boolean dryRun) {
        Path source = Path.of(sourcePath);
        Path target = targetPath == null ? null : Path.of(targetPath);
        try {
            if (Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
                return detail(operationId, intentId, kind, sourcePath, targetPath,
                        RestoreStatus.ALREADY_INTACT, "source already present");
            }
            if (target == null || !Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                LOGGER.warn("Cannot restore {}: {}", sourcePath, TARGET_MISSING);
                return detail(operationId, intentId, kind, sourcePath, targetPath,
                        RestoreStatus.SKIPPED, TARGET_MISSING);
            }
            if (kind == OperationKind.DELETE_DUPLICATE && expectedHash != null) {
                String actual = FileHasher.sha256(target);
                if (!expectedHash.equalsIgnoreCase(actual)) {
                    return detail(operationId, intentId, kind, sourcePath, targetPath,
                            RestoreStatus.FAILED, "kept copy " + targetPath + " no longer matches the recorded hash");
                }
            }
            if (dryRun) {
                return detail(operationId, intentId, kind, sourcePath, targetPath,
                        RestoreStatus.WOULD_RESTORE, "would " + inverse(kind) + " " + targetPath + " to " + sourcePath);
            }

            Path parent = source.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (kind == OperationKind.MOVE) {
                Files.move(target, source);
            } else {
                Files.copy(target, source, StandardCopyOption.COPY_ATTRIBUTES);
            }
            restoreCreationTime(source, createdTime);
            LOGGER.info("Restored {} from {}", sourcePath, targetPath);
            return detail(operationId, intentId, kind, sourcePath, targetPath,
                    RestoreStatus.RESTORED, inverse(kind) + " back from " + targetPath);
        } catch (IOException e) {
            LOGGER.error("Failed to restore {} from {}", sourcePath, targetPath, e);
            return detail(operationId, intentId, kind, sourcePath, targetPath,
                    RestoreStatus.FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    // not every filesystem lets the creation time be set
    private void restoreCreationTime(Path file, Instant createdTime) {
        if (createdTime == null) {
            return;
        }
        try {
            Files.getFileAttributeView(file, BasicFileAttributeView.class)
                    .setTimes(null, null, FileTime.from(createdTime));
        } catch (IOException | UnsupportedOperationException e) {
            LOGGER.debug("Could not restore creation time of {}: {}", file, e.getMessage());
        }
    }

    private static String inverse(OperationKind kind) {
        return kind == OperationKind.MOVE ? "move" : "copy";
    }

    private static RestoreDetail detail(Long operationId, String intentId, OperationKind kind, String source,
                                        String target, RestoreStatus status, String message) {
        return new RestoreDetail(operationId, intentId, kind, source, target, status, message);
    }
}

package com.example.fileorganizer.migrate;

import com.example.fileorganizer.exception.CollisionException;
import com.example.fileorganizer.exception.LogCorruptionException;
import com.example.fileorganizer.extract.FileHasher;
import com.example.fileorganizer.model.FailureKind;
import com.example.fileorganizer.transferlog.OperationKind;
import com.example.fileorganizer.transferlog.PendingTransfer;
import com.example.fileorganizer.transferlog.TransferLog;
import com.example.fileorganizer.transferlog.TransferOperation;
import com.example.fileorganizer.transferlog.TransferRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies or moves files into their target directories, journaling every mutation in the
 * transfer log before it happens. Nothing is ever overwritten.
 */
public class MigrationExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationExecutor.class);

    private final TransferLog transferLog;
    private final TargetReservations reservations;

    public MigrationExecutor(TransferLog transferLog) {
        this(transferLog, new TargetReservations());
    }

    public MigrationExecutor(TransferLog transferLog, TargetReservations reservations) {
        this.transferLog = transferLog;
        this.reservations = reservations;
    }

    /**
     * Executes all items in order. Outside a dry run a session named {@code migrate_<timestamp>}
     * is opened and ended around the plan when none is open yet.
     */
    public List<MigrationResult> executePlan(List<MigrationItem> items, boolean dryRun) throws IOException {
        List<MigrationResult> results = new ArrayList<>(items.size());
        if (dryRun) {
            // a fresh reservation set per dry run keeps repeated dry runs identical
            TargetReservations planned = new TargetReservations();
            for (MigrationItem item : items) {
                results.add(execute(item, true, planned));
            }
            return results;
        }

        boolean ownSession = !transferLog.isOpen();
        if (ownSession) {
            transferLog.start(transferLog.timestampedName("migrate"));
        }
        try {
            for (MigrationItem item : items) {
                results.add(execute(item, false, reservations));
            }
        } finally {
            if (ownSession) {
                transferLog.end();
            }
        }
        long failed = results.stream().filter(result -> !result.success()).count();
        LOGGER.info("Executed migration plan: {} items, {} failed", results.size(), failed);
        return results;
    }

    /**
     * Executes one item. Outside a dry run a transfer session must be open.
     */
    public MigrationResult executeItem(MigrationItem item, boolean dryRun) {
        return execute(item, dryRun, reservations);
    }

    private MigrationResult execute(MigrationItem item, boolean dryRun, TargetReservations targets) {
        Path source = item.source();
        String fileName = source.getFileName().toString();
        Path targetDirectory = item.targetDirectory();
        Path intended = targetDirectory.resolve(fileName);
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(source, BasicFileAttributes.class);
        } catch (IOException e) {
            return notStarted(item, null, intended, 0L, dryRun, FailureKind.IO_ERROR,
                    "source not readable: " + e.getMessage());
        }
        if (!attributes.isRegularFile()) {
            return notStarted(item, null, intended, 0L, dryRun, FailureKind.IO_ERROR, "source is not a regular file");
        }

        if (Files.exists(targetDirectory) && !Files.isDirectory(targetDirectory)) {
            return notStarted(item, null, intended, attributes.size(), dryRun, FailureKind.IO_ERROR,
                    "target " + targetDirectory + " is not a directory");
        }
        if (!dryRun) {
            try {
                Files.createDirectories(targetDirectory);
            } catch (IOException e) {
                return notStarted(item, null, intended, attributes.size(), false, FailureKind.IO_ERROR,
                        "cannot create target directory: " + e.getMessage());
            }
        }

        Path target;
        try {
            target = new CollisionResolver(targets).resolve(targetDirectory, fileName,
                    attributes.lastModifiedTime().toInstant());
        } catch (CollisionException e) {
            LOGGER.warn(e.getMessage());
            return notStarted(item, null, intended, attributes.size(), dryRun, FailureKind.COLLISION, e.getMessage());
        }
        boolean renamed = !target.getFileName().toString().equals(fileName);
        if (renamed) {
            LOGGER.info("{} already exists in {}, using {}", fileName, targetDirectory, target.getFileName());
        }
        if (dryRun) {
            return MigrationResult.succeeded(source, target, renamed, null);
        }

        try {
            return transfer(item, target, renamed, attributes);
        } finally {
            targets.release(target);
        }
    }

    private MigrationResult transfer(MigrationItem item, Path target, boolean renamed, BasicFileAttributes attributes) {
        Path source = item.source();
        String hash;
        PendingTransfer intent;
        try {
            hash = FileHasher.sha256(source);
        } catch (IOException e) {
            return notStarted(item, target, target, attributes.size(), false, FailureKind.IO_ERROR,
                    "source not readable: " + e.getMessage());
        }
        try {
            intent = transferLog.recordIntent(item.operation(), source.toString(), target.toString());
        } catch (LogCorruptionException e) {
            // the session document itself is unreadable, there is nowhere to record the failure
            return MigrationResult.failed(source, target, FailureKind.LOG_CORRUPTION, e.getMessage());
        } catch (IOException e) {
            return notStarted(item, target, target, attributes.size(), false, FailureKind.IO_ERROR,
                    "not started, write-ahead entry failed: " + e.getMessage());
        }

        try {
            switch (item.operation()) {
                case COPY:
                    Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
                    break;
                case MOVE:
                    Files.move(source, target);
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported operation " + item.operation());
            }
        } catch (IOException e) {
            FailureKind kind = e instanceof FileAlreadyExistsException ? FailureKind.COLLISION : FailureKind.IO_ERROR;
            LOGGER.warn("Failed to {} {} to {}: {}", item.operation().id(), source, target, e.getMessage());
            if (kind == FailureKind.IO_ERROR && item.operation() == OperationKind.COPY) {
                discardPartialCopy(target);
            }
            logFailure(item, target, attributes.size(), e, intent);
            return MigrationResult.failed(source, target, kind, e.getMessage());
        }

        try {
            TransferOperation operation = transferLog.append(TransferRequest.succeeded(
                    item.operation(), source.toString(), target.toString(), item.targetFolder(),
                    attributes.size(), hash, attributes.creationTime().toInstant()), intent.intentId());
            LOGGER.debug("{} {} -> {} (operation {})", item.operation().id(), source, target, operation.operationId());
            return MigrationResult.succeeded(source, target, renamed, operation.operationId());
        } catch (IOException e) {
            LOGGER.error("{} of {} to {} completed but could not be logged; intent {} stays pending",
                    item.operation().id(), source, target, intent.intentId(), e);
            FailureKind kind = e instanceof LogCorruptionException ? FailureKind.LOG_CORRUPTION : FailureKind.IO_ERROR;
            return MigrationResult.failed(source, target, kind, "transfer done but not logged: " + e.getMessage());
        }
    }

    // the target name was free when reserved, so anything there now is our own partial copy
    private void discardPartialCopy(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOGGER.warn("Could not remove partial copy {}: {}", target, e.getMessage());
        }
    }

    /**
     * Fails an item before any filesystem mutation. Outside a dry run the failure is still
     * appended to the open session so every attempted item appears in the log.
     */
    private MigrationResult notStarted(MigrationItem item, Path resultTarget, Path loggedTarget, long size,
                                       boolean dryRun, FailureKind kind, String message) {
        if (!dryRun) {
            try {
                transferLog.append(TransferRequest.failed(item.operation(), item.source().toString(),
                        loggedTarget.toString(), item.targetFolder(), size, message));
            } catch (IOException e) {
                LOGGER.error("Could not log failed {} of {}", item.operation().id(), item.source(), e);
            }
        }
        return MigrationResult.failed(item.source(), resultTarget, kind, message);
    }

    private void logFailure(MigrationItem item, Path target, long size, IOException cause, PendingTransfer intent) {
        try {
            transferLog.append(TransferRequest.failed(item.operation(), item.source().toString(), target.toString(),
                    item.targetFolder(), size, cause.getClass().getSimpleName() + ": " + cause.getMessage()),
                    intent.intentId());
        } catch (IOException e) {
            LOGGER.error("Could not log failed {} of {}", item.operation().id(), item.source(), e);
        }
    }
}

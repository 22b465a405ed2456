package com.example.fileorganizer;

import com.example.fileorganizer.classify.ClassificationContext;
import com.example.fileorganizer.classify.ClassificationContext.Stage;
import com.example.fileorganizer.classify.ClassificationContexts;
import com.example.fileorganizer.classify.Classifier;
import com.example.fileorganizer.exception.ClassificationTimeoutException;
import com.example.fileorganizer.exception.LogCorruptionException;
import com.example.fileorganizer.extract.FileRecordReader;
import com.example.fileorganizer.migrate.MigrationExecutor;
import com.example.fileorganizer.migrate.MigrationItem;
import com.example.fileorganizer.migrate.MigrationResult;
import com.example.fileorganizer.migrate.TargetReservations;
import com.example.fileorganizer.model.ClassificationDecision;
import com.example.fileorganizer.model.FailureKind;
import com.example.fileorganizer.model.FileRecord;
import com.example.fileorganizer.model.TimingBreakdown;
import com.example.fileorganizer.store.ProcessingStatus;
import com.example.fileorganizer.store.ResultEntry;
import com.example.fileorganizer.store.ResultStore;
import com.example.fileorganizer.transferlog.OperationKind;
import com.example.fileorganizer.transferlog.TransferLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Orchestrates an organize run: a fixed worker pool classifies and migrates one file per
 * task, while a dedicated consumer thread appends finished outcomes to the result store.
 *
 * <p>In a dry run the workers only classify; targets are then planned on the calling thread
 * in input order, so repeated dry runs over the same input produce the same plan.
 */
public final class OrganizeEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(OrganizeEngine.class);
    private static final ResultEntry POISON = new ResultEntry("poison", null, null, null, null, null, null,
            null, null, null, false, null, null, 0, null, null);

    private final Classifier classifier;
    private final TransferLog transferLog;
    private final ResultStore resultStore;
    private final OperationKind operation;
    private final int threadCount;
    private final Duration fileTimeout;
    private final ProcessingLimiter limiter;
    private final FileRecordReader reader = new FileRecordReader();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final Object startGate = new Object();

    public OrganizeEngine(Classifier classifier,
                          TransferLog transferLog,
                          ResultStore resultStore,
                          OperationKind operation,
                          int threadCount,
                          Duration fileTimeout) {
        this(classifier, transferLog, resultStore, operation, threadCount, fileTimeout, ProcessingLimiter.NO_LIMIT);
    }

    OrganizeEngine(Classifier classifier,
                   TransferLog transferLog,
                   ResultStore resultStore,
                   OperationKind operation,
                   int threadCount,
                   Duration fileTimeout,
                   ProcessingLimiter limiter) {
        this.classifier = classifier;
        this.transferLog = transferLog;
        this.resultStore = resultStore;
        this.operation = operation;
        this.threadCount = Math.max(1, threadCount);
        this.fileTimeout = fileTimeout;
        this.limiter = limiter;
    }

    /**
     * Asks the run to stop starting new files. Files already in flight complete.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    /**
     * Classifies and migrates every file. Outside a dry run a transfer session named
     * {@code organize_<timestamp>} is used unless one is already open. A path listed more than
     * once is processed for its first occurrence only; later ones are reported as skipped.
     */
    public OrganizeReport organize(List<FileRecord> files, Path targetRoot, boolean dryRun)
            throws IOException, InterruptedException {
        if (!Files.isDirectory(targetRoot)) {
            throw new NoSuchFileException(targetRoot.toString(), null, "target directory does not exist");
        }
        long runStart = System.currentTimeMillis();
        stopRequested.set(false);

        boolean ownSession = !dryRun && !transferLog.isOpen();
        String sessionName = null;
        if (ownSession) {
            sessionName = transferLog.start(transferLog.timestampedName("organize")).name();
        } else if (!dryRun) {
            sessionName = transferLog.current().map(handle -> handle.name()).orElse(null);
        }

        ClassificationContexts contexts = new ClassificationContexts();
        MigrationExecutor executor = new MigrationExecutor(transferLog, new TargetReservations());
        BlockingQueue<ResultEntry> resultQueue = new LinkedBlockingQueue<>();
        AtomicInteger refusedWrites = new AtomicInteger();

        // the store is only written outside dry runs
        Thread consumer = !dryRun && resultStore != null
                ? new Thread(() -> consumeResults(resultQueue, refusedWrites), "result-store-writer")
                : null;
        if (consumer != null) {
            consumer.start();
        }

        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        ExecutorService fileExecutor = Executors.newFixedThreadPool(threadCount);
        AtomicLong started = new AtomicLong();
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>(files.size());
            Set<Path> seen = new HashSet<>();
            for (FileRecord file : files) {
                if (!seen.add(file.toPath().toAbsolutePath().normalize())) {
                    LOGGER.warn("{} is listed more than once, processing it once", file.path());
                    futures.add(CompletableFuture.completedFuture(FileOutcome.duplicate(file)));
                    continue;
                }
                futures.add(fileExecutor.submit(() -> {
                    if (!tryStart(started)) {
                        return FileOutcome.skipped(file);
                    }
                    FileOutcome outcome = process(file, targetRoot, dryRun, contexts, executor);
                    if (consumer != null && outcome.status() != ProcessingStatus.SKIPPED) {
                        resultQueue.put(toEntry(outcome));
                    }
                    return outcome;
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    FileOutcome outcome = futures.get(i).get();
                    outcomes.add(dryRun && outcome.status() == ProcessingStatus.PLANNED
                            ? plan(outcome, targetRoot, executor)
                            : outcome);
                } catch (ExecutionException ex) {
                    LOGGER.error("Worker failed for {}", files.get(i).path(), ex.getCause());
                    outcomes.add(FileOutcome.failed(files.get(i), FailureKind.IO_ERROR, String.valueOf(ex.getCause()), 0));
                }
            }
        } finally {
            fileExecutor.shutdownNow();
            if (consumer != null) {
                resultQueue.add(POISON);
                consumer.join();
            }
            if (ownSession) {
                transferLog.end();
            }
        }

        OrganizeReport report = new OrganizeReport(targetRoot, dryRun, sessionName, outcomes,
                System.currentTimeMillis() - runStart);
        LOGGER.info("Organize run{} finished: {} files, {} succeeded, {} failed, {} skipped in {} ms",
                dryRun ? " (dry run)" : "", outcomes.size(), report.successCount(), report.failureCount(),
                report.count(ProcessingStatus.SKIPPED), report.elapsedMillis());
        if (refusedWrites.get() > 0) {
            LOGGER.error("{} results could not be written to {}", refusedWrites.get(), resultStore.path());
        }
        return report;
    }

    private boolean tryStart(AtomicLong started) {
        synchronized (startGate) {
            if (stopRequested.get() || limiter.shouldStop(started.get())) {
                return false;
            }
            started.incrementAndGet();
            return true;
        }
    }

    private FileOutcome process(FileRecord scanned,
                                Path targetRoot,
                                boolean dryRun,
                                ClassificationContexts contexts,
                                MigrationExecutor executor) {
        long start = System.currentTimeMillis();
        FileRecord file;
        try {
            file = reader.read(scanned.toPath());
        } catch (IOException ex) {
            LOGGER.warn("Skipping {}: {}", scanned.path(), ex.getMessage());
            return FileOutcome.failed(scanned, FailureKind.IO_ERROR, "source not readable: " + ex.getMessage(),
                    elapsedSince(start));
        }
        ClassificationContext context = contexts.open(file);
        context.recordTiming(Stage.METADATA, System.currentTimeMillis() - start);
        try {
            ClassificationDecision decision = FileTimeouts.call("classify " + file.name(), fileTimeout,
                    () -> classifier.classify(context, targetRoot));
            if (!decision.success()) {
                FailureKind kind = decision.backendDegraded() ? FailureKind.BACKEND_ERROR : FailureKind.CLASSIFICATION_FAILURE;
                String message = decision.backendDegraded()
                        ? decision.reason() + "; backend unavailable: " + context.degradationReason()
                        : decision.reason();
                LOGGER.info("No target directory for {}: {}", file.name(), message);
                return outcome(file, ProcessingStatus.FAILED, kind, message, decision, null, false, start, context);
            }

            if (dryRun) {
                return outcome(file, ProcessingStatus.PLANNED, null, decision.reason(), decision, null, false,
                        start, context);
            }
            Path targetDirectory = decision.resolveAgainst(targetRoot);
            MigrationResult result = executor.executeItem(
                    new MigrationItem(file.toPath(), targetDirectory, operation, decision.relativePath()), false);
            if (!result.success()) {
                return outcome(file, ProcessingStatus.FAILED, result.failureKind(), result.error(), decision,
                        result.target(), false, start, context);
            }
            return outcome(file, ProcessingStatus.MIGRATED, null, decision.reason(), decision, result.target(), result.renamed(),
                    start, context);
        } catch (ClassificationTimeoutException ex) {
            return outcome(file, ProcessingStatus.TIMED_OUT, FailureKind.TIMEOUT, ex.getMessage(), null, null, false,
                    start, context);
        } catch (LogCorruptionException ex) {
            LOGGER.error("Cannot process {}: {}", file.path(), ex.getMessage());
            return outcome(file, ProcessingStatus.FAILED, FailureKind.LOG_CORRUPTION, ex.getMessage(), null, null,
                    false, start, context);
        } catch (IOException ex) {
            LOGGER.warn("Failed to process {}", file.path(), ex);
            return outcome(file, ProcessingStatus.FAILED, FailureKind.IO_ERROR, ex.getMessage(), null, null, false,
                    start, context);
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected failure processing {}", file.path(), ex);
            return outcome(file, ProcessingStatus.FAILED, FailureKind.IO_ERROR, String.valueOf(ex), null, null, false,
                    start, context);
        } finally {
            contexts.discard(file.toPath());
        }
    }

    /**
     * Reserves the target of a classified dry-run file. Called in input order.
     */
    private FileOutcome plan(FileOutcome classified, Path targetRoot, MigrationExecutor executor) {
        FileRecord file = classified.file();
        ClassificationDecision decision = classified.decision();
        MigrationResult result = executor.executeItem(new MigrationItem(file.toPath(),
                decision.resolveAgainst(targetRoot), operation, decision.relativePath()), true);
        if (!result.success()) {
            return new FileOutcome(file, ProcessingStatus.FAILED, result.failureKind(), result.error(), decision,
                    result.target(), false, classified.timings());
        }
        return new FileOutcome(file, ProcessingStatus.PLANNED, null, classified.message(), decision,
                result.target(), result.renamed(), classified.timings());
    }

    private FileOutcome outcome(FileRecord file,
                                ProcessingStatus status,
                                FailureKind kind,
                                String message,
                                ClassificationDecision decision,
                                Path target,
                                boolean renamed,
                                long start,
                                ClassificationContext context) {
        TimingBreakdown timing = new TimingBreakdown(
                context.timing(Stage.METADATA),
                context.timing(Stage.CONTENT_EXTRACTION),
                context.timing(Stage.SUMMARY),
                context.timing(Stage.RECOMMENDATION),
                elapsedSince(start));
        return new FileOutcome(file, status, kind, message, decision, target, renamed, timing);
    }

    private ResultEntry toEntry(FileOutcome outcome) {
        ClassificationDecision decision = outcome.decision();
        FileRecord file = outcome.file();
        return new ResultEntry(
                file.name(),
                file.path(),
                decision == null ? null : decision.relativePath(),
                outcome.finalTarget() == null ? null : outcome.finalTarget().toString(),
                decision == null ? List.of() : decision.levelTags(),
                decision == null ? outcome.message() : decision.reason(),
                decision == null ? null : decision.summary(),
                decision == null ? null : decision.status(),
                operation,
                outcome.status(),
                outcome.isSuccess(),
                outcome.isSuccess() ? null : outcome.message(),
                outcome.timings() == null ? TimingBreakdown.NONE : outcome.timings(),
                outcome.processingTimeMillis(),
                Instant.now(),
                file
        );
    }

    private void consumeResults(BlockingQueue<ResultEntry> queue, AtomicInteger refusedWrites) {
        try {
            while (true) {
                ResultEntry entry = queue.take();
                if (entry == POISON) {
                    return;
                }
                try {
                    if (!resultStore.append(entry)) {
                        refusedWrites.incrementAndGet();
                    }
                } catch (LogCorruptionException ex) {
                    refusedWrites.incrementAndGet();
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.error("Result store writer stopped unexpectedly", ex);
        }
    }

    private static long elapsedSince(long start) {
        return System.currentTimeMillis() - start;
    }
}

package com.example.fileorganizer.transferlog;

import com.example.fileorganizer.exception.LogCorruptionException;
import com.example.fileorganizer.json.ObjectMappers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransferLogTest {
    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

    private Path logDirectory;
    private Path workDirectory;
    private TransferLog log;

    @BeforeEach
    void setUp() throws Exception {
        Path root = Files.createTempDirectory("transfer-log");
        logDirectory = root.resolve("logs");
        workDirectory = Files.createDirectories(root.resolve("work"));
        log = new TransferLog(logDirectory, ObjectMappers.create(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void operationIdsIncreaseAndCountsFollowOutcomes() throws Exception {
        log.start("organize");
        TransferOperation first = log.append(copied("a.txt"));
        TransferOperation second = log.append(TransferRequest.failed(OperationKind.COPY,
                "/in/b.txt", "/out/b.txt", "Docs", 3, "disk full"));
        TransferOperation third = log.append(copied("c.txt"));
        log.end();

        assertEquals(1, first.operationId());
        assertEquals(2, second.operationId());
        assertEquals(3, third.operationId());
        TransferSession session = log.load("organize");
        assertEquals(3, session.info().totalOperations());
        assertEquals(2, session.info().successfulOperations());
        assertEquals(1, session.info().failedOperations());
        assertEquals("disk full", session.operation(2).orElseThrow().errorMessage());
        assertTrue(session.info().isEnded());
    }

    @Test
    void endedSessionIsTerminal() throws Exception {
        log.start("once");
        log.end();

        assertFalse(log.isOpen());
        assertThrows(IllegalStateException.class, () -> log.append(copied("late.txt")));
        assertThrows(IllegalStateException.class, () -> log.end());
    }

    @Test
    void appendWithoutSessionIsRejected() {
        assertThrows(IllegalStateException.class, () -> log.append(copied("a.txt")));
        assertThrows(IllegalStateException.class,
                () -> log.recordIntent(OperationKind.MOVE, "/in/a.txt", "/out/a.txt"));
    }

    @Test
    void onlyOneSessionMayBeOpen() throws Exception {
        log.start("first");

        assertThrows(IllegalStateException.class, () -> log.start("second"));
        assertEquals("first", log.current().orElseThrow().name());
    }

    @Test
    void sessionNamesAreSanitizedAndNeverReused() throws Exception {
        SessionHandle first = log.start("dedup my/folder");
        log.end();
        SessionHandle second = log.start("dedup my/folder");
        log.end();

        assertEquals("dedup_my_folder", first.name());
        assertEquals("dedup_my_folder_2", second.name());
        assertEquals("organize_20240301_101530", log.timestampedName("organize"));
    }

    @Test
    void sessionDocumentUsesSnakeCaseKeys() throws Exception {
        SessionHandle handle = log.start("keys");
        log.append(copied("a.txt"));
        log.end();

        String json = Files.readString(handle.file());
        assertTrue(json.contains("\"session_info\""));
        assertTrue(json.contains("\"operation_id\" : 1"));
        assertTrue(json.contains("\"operation_type\" : \"copy\""));
        assertTrue(json.contains("\"target_folder\" : \"Docs\""));
    }

    @Test
    void restoreMovesFilesBackAndIsIdempotent() throws Exception {
        Path source = workDirectory.resolve("in/report.pdf");
        Path target = workDirectory.resolve("out/Finance/report.pdf");
        Files.createDirectories(source.getParent());
        Files.createDirectories(target.getParent());
        Files.writeString(source, "report");
        log.start("moves");
        Files.move(source, target);
        log.append(TransferRequest.succeeded(OperationKind.MOVE, source.toString(), target.toString(),
                "Finance", 6, "hash", null));
        log.end();

        RestoreReport first = log.restore("moves", null, false);
        RestoreReport second = log.restore("moves.json", null, false);

        assertEquals(1, first.count(RestoreStatus.RESTORED));
        assertTrue(first.isClean());
        assertEquals("report", Files.readString(source));
        assertFalse(Files.exists(target));
        assertEquals(1, second.count(RestoreStatus.ALREADY_INTACT));
        assertEquals(0, second.count(RestoreStatus.RESTORED));
    }

    @Test
    void restoreSkipsOperationsWhoseTargetIsGone() throws Exception {
        Path source = workDirectory.resolve("gone.txt");
        log.start("gone");
        log.append(TransferRequest.succeeded(OperationKind.MOVE, source.toString(),
                workDirectory.resolve("out/gone.txt").toString(), "out", 1, "hash", null));
        log.end();

        RestoreReport report = log.restore("gone", null, false);

        RestoreDetail detail = report.details().get(0);
        assertEquals(RestoreStatus.SKIPPED, detail.status());
        assertEquals("target missing", detail.message());
        assertFalse(Files.exists(source));
    }

    @Test
    void dryRunRestoreChangesNothing() throws Exception {
        Path source = workDirectory.resolve("a.txt");
        Path target = workDirectory.resolve("b.txt");
        Files.writeString(target, "content");
        log.start("dry");
        log.append(TransferRequest.succeeded(OperationKind.MOVE, source.toString(), target.toString(),
                "", 7, "hash", null));
        log.end();

        RestoreReport report = log.restore("dry", null, true);

        assertTrue(report.dryRun());
        assertEquals(1, report.count(RestoreStatus.WOULD_RESTORE));
        assertFalse(Files.exists(source));
        assertTrue(Files.exists(target));
    }

    @Test
    void restoreHonorsSelectedOperationIds() throws Exception {
        Path first = workDirectory.resolve("first.txt");
        Path second = workDirectory.resolve("second.txt");
        Path firstTarget = Files.writeString(workDirectory.resolve("first-moved.txt"), "1");
        Path secondTarget = Files.writeString(workDirectory.resolve("second-moved.txt"), "2");
        log.start("selected");
        log.append(TransferRequest.succeeded(OperationKind.MOVE, first.toString(), firstTarget.toString(),
                "", 1, "h1", null));
        log.append(TransferRequest.succeeded(OperationKind.MOVE, second.toString(), secondTarget.toString(),
                "", 1, "h2", null));
        log.end();

        RestoreReport report = log.restore("selected", Set.of(2L), false);

        assertEquals(1, report.total());
        assertEquals(2L, report.details().get(0).operationId());
        assertTrue(Files.exists(second));
        assertFalse(Files.exists(first));
    }

    @Test
    void interruptedIntentIsRestoredWithTheSession() throws Exception {
        Path source = Files.writeString(workDirectory.resolve("photo.jpg"), "jpeg");
        Path target = workDirectory.resolve("Photos/photo.jpg");
        Files.createDirectories(target.getParent());
        log.start("crashed");
        PendingTransfer intent = log.recordIntent(OperationKind.MOVE, source.toString(), target.toString());
        Files.move(source, target);
        // process dies here, before the outcome is appended

        TransferLog reopened = new TransferLog(logDirectory, ObjectMappers.create());
        TransferSession session = reopened.load("crashed");
        assertEquals(1, session.pending().size());
        assertEquals(intent.intentId(), session.pending().get(0).intentId());

        RestoreReport report = reopened.restore("crashed", List.of(), false);

        RestoreDetail detail = report.details().get(0);
        assertNull(detail.operationId());
        assertEquals(intent.intentId(), detail.intentId());
        assertEquals(RestoreStatus.RESTORED, detail.status());
        assertTrue(Files.exists(source));
    }

    @Test
    void appendClearsTheMatchingIntent() throws Exception {
        log.start("cleared");
        PendingTransfer intent = log.recordIntent(OperationKind.COPY, "/in/a.txt", "/out/a.txt");
        log.append(copied("a.txt"), intent.intentId());
        log.end();

        assertTrue(log.load("cleared").pending().isEmpty());
    }

    @Test
    void duplicateRestoreRefusesAChangedKeptCopy() throws Exception {
        Path kept = Files.writeString(workDirectory.resolve("kept.txt"), "changed since");
        Path removed = workDirectory.resolve("copy.txt");
        log.start("dedup");
        log.append(TransferRequest.succeeded(OperationKind.DELETE_DUPLICATE, removed.toString(), kept.toString(),
                "", 13, "0000", null));
        log.end();

        RestoreReport report = log.restore("dedup", null, false);

        assertEquals(RestoreStatus.FAILED, report.details().get(0).status());
        assertFalse(report.isClean());
        assertFalse(Files.exists(removed));
    }

    @Test
    void corruptedSessionIsReportedAndSkippedWhenListing() throws Exception {
        log.start("healthy");
        log.end();
        Files.writeString(logDirectory.resolve("broken.json"), "{\"session_info\": ");

        assertThrows(LogCorruptionException.class, () -> log.load("broken"));
        List<SessionInfo> sessions = log.listSessions();
        assertEquals(1, sessions.size());
        assertEquals("healthy", sessions.get(0).sessionName());
    }

    @Test
    void documentWithoutHeaderIsCorrupt() throws Exception {
        Files.createDirectories(logDirectory);
        Files.writeString(logDirectory.resolve("headless.json"), "{\"operations\": []}");

        assertThrows(LogCorruptionException.class, () -> log.load("headless"));
    }

    @Test
    void unknownSessionIsMissing() {
        assertThrows(NoSuchFileException.class, () -> log.load("nope"));
    }

    @Test
    void summaryCountsSuccessfulOperations() throws Exception {
        log.start("summary");
        log.append(TransferRequest.succeeded(OperationKind.COPY, "/in/a", "/out/Docs/a", "Docs", 10, "h", null));
        log.append(TransferRequest.succeeded(OperationKind.MOVE, "/in/b", "/out/Docs/b", "Docs", 20, "h", null));
        log.append(TransferRequest.succeeded(OperationKind.MOVE, "/in/c", "/out/Pics/c", "Pics", 5, "h", null));
        log.append(TransferRequest.failed(OperationKind.MOVE, "/in/d", "/out/Pics/d", "Pics", 99, "denied"));
        log.recordIntent(OperationKind.MOVE, "/in/e", "/out/Pics/e");
        log.end();

        SessionSummary summary = log.summarize("summary");

        assertEquals(1L, summary.operationsByKind().get(OperationKind.COPY));
        assertEquals(2L, summary.operationsByKind().get(OperationKind.MOVE));
        assertEquals(2L, summary.operationsByTargetFolder().get("Docs"));
        assertEquals(1L, summary.operationsByTargetFolder().get("Pics"));
        assertEquals(35, summary.totalBytes());
        assertEquals(1, summary.pendingIntents());
    }

    @Test
    void cleanupRemovesOnlyOldSessions() throws Exception {
        TransferLog lastMonth = new TransferLog(logDirectory, ObjectMappers.create(),
                Clock.fixed(NOW.minus(Duration.ofDays(30)), ZoneOffset.UTC));
        lastMonth.start("old");
        lastMonth.end();
        log.start("recent");
        log.end();
        log.start("open");

        int removed = log.cleanupOlderThan(Duration.ofDays(7));

        assertEquals(1, removed);
        assertFalse(Files.exists(logDirectory.resolve("old.json")));
        assertTrue(Files.exists(logDirectory.resolve("recent.json")));
        assertTrue(Files.exists(logDirectory.resolve("open.json")));
        assertNotNull(log.load("recent").info());
    }

    private static TransferRequest copied(String name) {
        return TransferRequest.succeeded(OperationKind.COPY, "/in/" + name, "/out/Docs/" + name,
                "Docs", 1, "hash", null);
    }
}

package com.example.fileorganizer.migrate;

import com.example.fileorganizer.json.ObjectMappers;
import com.example.fileorganizer.model.FailureKind;
import com.example.fileorganizer.transferlog.OperationKind;
import com.example.fileorganizer.transferlog.SessionInfo;
import com.example.fileorganizer.transferlog.TransferLog;
import com.example.fileorganizer.transferlog.TransferOperation;
import com.example.fileorganizer.transferlog.TransferSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationExecutorTest {
    private static final Instant MODIFIED = Instant.parse("2024-01-05T09:30:00Z");

    private Path sourceDirectory;
    private Path targetRoot;
    private Path logDirectory;
    private TransferLog transferLog;
    private MigrationExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        Path root = Files.createTempDirectory("migrate");
        sourceDirectory = Files.createDirectories(root.resolve("in"));
        targetRoot = Files.createDirectories(root.resolve("out"));
        logDirectory = root.resolve("logs");
        transferLog = new TransferLog(logDirectory, ObjectMappers.create());
        executor = new MigrationExecutor(transferLog);
    }

    @Test
    void copyRenamesOnCollisionAndLogsTheOperation() throws Exception {
        Path source = sourceFile("report.pdf", "new report");
        Path finance = Files.createDirectories(targetRoot.resolve("Finance"));
        Files.writeString(finance.resolve("report.pdf"), "old report");

        transferLog.start("copies");
        MigrationResult result = executor.executeItem(
                new MigrationItem(source, finance, OperationKind.COPY, "Finance"), false);
        transferLog.end();

        String stamp = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").format(MODIFIED.atZone(ZoneId.systemDefault()));
        assertTrue(result.success());
        assertTrue(result.renamed());
        assertEquals(finance.resolve("report_" + stamp + ".pdf"), result.target());
        assertEquals("old report", Files.readString(finance.resolve("report.pdf")));
        assertEquals("new report", Files.readString(result.target()));
        assertTrue(Files.exists(source));

        TransferSession session = transferLog.load("copies");
        TransferOperation operation = session.operation(result.operationId()).orElseThrow();
        assertEquals(OperationKind.COPY, operation.kind());
        assertEquals("Finance", operation.targetFolder());
        assertEquals(10, operation.fileSize());
        assertNotNull(operation.fileHash());
        assertTrue(session.pending().isEmpty());
    }

    @Test
    void moveRemovesTheSource() throws Exception {
        Path source = sourceFile("photo.jpg", "jpeg");
        Path photos = targetRoot.resolve("Photos");

        transferLog.start("moves");
        MigrationResult result = executor.executeItem(new MigrationItem(source, photos, OperationKind.MOVE), false);
        transferLog.end();

        assertTrue(result.success());
        assertFalse(result.renamed());
        assertFalse(Files.exists(source));
        assertEquals("jpeg", Files.readString(photos.resolve("photo.jpg")));
    }

    @Test
    void dryRunTouchesNothingAndIsRepeatable() throws Exception {
        Path first = sourceFile("a.txt", "one");
        Path nested = Files.createDirectories(sourceDirectory.resolve("nested"));
        Path second = Files.writeString(nested.resolve("a.txt"), "two");
        Files.setLastModifiedTime(second, FileTime.from(MODIFIED));
        Path docs = targetRoot.resolve("Docs");
        List<MigrationItem> plan = List.of(
                new MigrationItem(first, docs, OperationKind.MOVE, "Docs"),
                new MigrationItem(second, docs, OperationKind.MOVE, "Docs"));
        List<String> before = snapshot();

        List<MigrationResult> run1 = executor.executePlan(plan, true);
        List<MigrationResult> run2 = executor.executePlan(plan, true);

        assertEquals(before, snapshot());
        assertFalse(Files.exists(docs));
        assertFalse(Files.exists(logDirectory));
        assertEquals(targets(run1), targets(run2));
        assertNotEquals(run1.get(0).target(), run1.get(1).target());
        assertTrue(run1.stream().allMatch(MigrationResult::success));
        assertNull(run1.get(0).operationId());
    }

    @Test
    void missingSourceIsLoggedAsFailed() throws Exception {
        transferLog.start("missing");
        MigrationResult result = executor.executeItem(new MigrationItem(
                sourceDirectory.resolve("ghost.txt"), targetRoot.resolve("Docs"), OperationKind.COPY), false);
        SessionInfo info = transferLog.end();

        assertFalse(result.success());
        assertEquals(FailureKind.IO_ERROR, result.failureKind());
        assertEquals(1, info.totalOperations());
        assertEquals(1, info.failedOperations());
        TransferOperation logged = transferLog.load("missing").operations().get(0);
        assertFalse(logged.success());
        assertEquals(targetRoot.resolve("Docs").resolve("ghost.txt").toString(), logged.targetPath());
        assertTrue(logged.errorMessage().startsWith("source not readable"));
    }

    @Test
    void everyAttemptedItemOfAPlanIsLogged() throws Exception {
        Path blocker = Files.writeString(targetRoot.resolve("Blocked"), "not a directory");
        Path b = sourceFile("b.txt", "two");
        Path ok = sourceFile("ok.txt", "three");

        transferLog.start("mixed");
        List<MigrationResult> results = executor.executePlan(List.of(
                new MigrationItem(sourceDirectory.resolve("ghost.txt"), targetRoot.resolve("Docs"), OperationKind.COPY, "Docs"),
                new MigrationItem(b, blocker, OperationKind.COPY, "Blocked"),
                new MigrationItem(ok, targetRoot.resolve("Docs"), OperationKind.COPY, "Docs")), false);
        assertTrue(transferLog.isOpen());
        SessionInfo info = transferLog.end();

        assertEquals(3, results.size());
        assertEquals(2, results.stream().filter(result -> !result.success()).count());
        assertEquals(3, info.totalOperations());
        assertEquals(1, info.successfulOperations());
        assertEquals(2, info.failedOperations());
        TransferSession session = transferLog.load("mixed");
        assertEquals("Blocked", session.operations().get(1).targetFolder());
        assertTrue(session.pending().isEmpty());
    }

    @Test
    void targetThatIsAFileFails() throws Exception {
        Path source = sourceFile("a.txt", "one");
        Path blocker = Files.writeString(targetRoot.resolve("Docs"), "not a directory");

        MigrationResult result = executor.executeItem(
                new MigrationItem(source, blocker, OperationKind.COPY), true);

        assertFalse(result.success());
        assertEquals(FailureKind.IO_ERROR, result.failureKind());
    }

    @Test
    void planOpensAndEndsItsOwnSession() throws Exception {
        Path a = sourceFile("a.txt", "one");
        Path b = sourceFile("b.txt", "two");

        List<MigrationResult> results = executor.executePlan(List.of(
                new MigrationItem(a, targetRoot.resolve("Docs"), OperationKind.COPY, "Docs"),
                new MigrationItem(b, targetRoot.resolve("Docs"), OperationKind.MOVE, "Docs")), false);

        assertTrue(results.stream().allMatch(MigrationResult::success));
        assertFalse(transferLog.isOpen());
        List<SessionInfo> sessions = transferLog.listSessions();
        assertEquals(1, sessions.size());
        assertTrue(sessions.get(0).sessionName().startsWith("migrate_"));
        assertEquals(2, sessions.get(0).successfulOperations());
        assertTrue(sessions.get(0).isEnded());
    }

    @Test
    void deleteDuplicateIsNotAMigration() {
        assertThrows(IllegalArgumentException.class, () -> new MigrationItem(
                sourceDirectory.resolve("a"), targetRoot, OperationKind.DELETE_DUPLICATE));
    }

    private Path sourceFile(String name, String content) throws Exception {
        Path file = Files.writeString(sourceDirectory.resolve(name), content);
        Files.setLastModifiedTime(file, FileTime.from(MODIFIED));
        return file;
    }

    private List<String> snapshot() throws Exception {
        try (Stream<Path> files = Files.walk(sourceDirectory.getParent())) {
            return files.map(Path::toString).sorted().collect(Collectors.toList());
        }
    }

    private static List<Path> targets(List<MigrationResult> results) {
        return results.stream().map(MigrationResult::target).collect(Collectors.toList());
    }
}

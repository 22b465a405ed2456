package com.example.fileorganizer.transferlog;

import com.example.fileorganizer.exception.LogCorruptionException;
import com.example.fileorganizer.json.AtomicJsonFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Write-ahead journal of filesystem operations, one JSON document per session under a log
 * directory. At most one session is open per instance; every change rewrites the whole
 * document through an atomic file swap.
 */
public class TransferLog {
    private static final Logger LOGGER = LoggerFactory.getLogger(TransferLog.class);
    private static final String SUFFIX = ".json";
    private static final Pattern UNSAFE_NAME_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final DateTimeFormatter SESSION_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path logDirectory;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final SessionRestorer restorer = new SessionRestorer();
    private SessionHandle current;
    private boolean ended;

    public TransferLog(Path logDirectory, ObjectMapper mapper) {
        this(logDirectory, mapper, Clock.systemDefaultZone());
    }

    public TransferLog(Path logDirectory, ObjectMapper mapper, Clock clock) {
        this.logDirectory = logDirectory;
        this.mapper = mapper;
        this.clock = clock;
    }

    public Path logDirectory() {
        return logDirectory;
    }

    /**
     * Builds a session name like {@code migrate_20240105_093000} from the log's clock.
     */
    public String timestampedName(String prefix) {
        return prefix + "_" + SESSION_TIMESTAMP.format(clock.instant().atZone(clock.getZone()));
    }

    public synchronized SessionHandle start(String name) throws IOException {
        if (current != null && !ended) {
            throw new IllegalStateException("Session " + current.name() + " is still open");
        }
        Files.createDirectories(logDirectory);
        String base = UNSAFE_NAME_CHARS.matcher(name == null || name.isBlank() ? "session" : name.strip())
                .replaceAll("_");
        String sessionName = base;
        int attempt = 1;
        while (Files.exists(sessionFile(sessionName))) {
            attempt++;
            sessionName = base + "_" + attempt;
        }
        Path file = sessionFile(sessionName);
        new AtomicJsonFile(mapper, file).write(TransferSession.empty(SessionInfo.opened(sessionName, clock.instant())));
        current = new SessionHandle(sessionName, file);
        ended = false;
        LOGGER.info("Started transfer session {} at {}", sessionName, file);
        return current;
    }

    public synchronized boolean isOpen() {
        return current != null && !ended;
    }

    public synchronized Optional<SessionHandle> current() {
        return isOpen() ? Optional.of(current) : Optional.empty();
    }

    /**
     * Records that an operation is about to mutate the filesystem. Must succeed before the
     * mutation starts.
     */
    public synchronized PendingTransfer recordIntent(OperationKind kind, String sourcePath, String targetPath)
            throws IOException {
        SessionHandle handle = requireOpen();
        AtomicJsonFile file = new AtomicJsonFile(mapper, handle.file());
        TransferSession session = readSession(file);
        PendingTransfer intent = new PendingTransfer(
                UUID.randomUUID().toString(), clock.instant(), kind, sourcePath, targetPath);
        file.write(session.withPending(intent));
        return intent;
    }

    public TransferOperation append(TransferRequest request) throws IOException {
        return append(request, null);
    }

    /**
     * Appends the outcome of an operation, assigning the next id and clearing its intent.
     */
    public synchronized TransferOperation append(TransferRequest request, String intentId) throws IOException {
        SessionHandle handle = requireOpen();
        AtomicJsonFile file = new AtomicJsonFile(mapper, handle.file());
        TransferSession session = readSession(file);
        TransferOperation operation = TransferOperation.from(session.nextOperationId(), clock.instant(), request);
        file.write(session.withOperation(operation, intentId));
        if (!operation.success()) {
            LOGGER.warn("Logged failed {} of {}: {}", request.kind().id(), request.sourcePath(), request.errorMessage());
        }
        return operation;
    }

    public synchronized SessionInfo end() throws IOException {
        SessionHandle handle = requireOpen();
        AtomicJsonFile file = new AtomicJsonFile(mapper, handle.file());
        TransferSession session = readSession(file);
        SessionInfo info = session.info().ended(clock.instant());
        file.write(session.withInfo(info));
        ended = true;
        LOGGER.info("Ended transfer session {}: {} operations, {} succeeded, {} failed",
                info.sessionName(), info.totalOperations(), info.successfulOperations(), info.failedOperations());
        return info;
    }

    /**
     * Loads a session by name (with or without {@code .json}) or by path.
     */
    public TransferSession load(String session) throws IOException {
        Path file = resolve(session);
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "no such transfer session");
        }
        return readSession(new AtomicJsonFile(mapper, file));
    }

    /**
     * Headers of all readable sessions, newest first. Unreadable documents are skipped.
     */
    public List<SessionInfo> listSessions() throws IOException {
        List<SessionInfo> sessions = new ArrayList<>();
        for (Path file : sessionFiles()) {
            try {
                sessions.add(readSession(new AtomicJsonFile(mapper, file)).info());
            } catch (LogCorruptionException e) {
                LOGGER.warn("Skipping unreadable transfer session {}: {}", file, e.getMessage());
            }
        }
        sessions.sort(Comparator.comparing(SessionInfo::startTime,
                Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed());
        return sessions;
    }

    public SessionSummary summarize(String session) throws IOException {
        TransferSession loaded = load(session);
        Map<OperationKind, Long> byKind = new EnumMap<>(OperationKind.class);
        Map<String, Long> byFolder = new TreeMap<>();
        long totalBytes = 0;
        for (TransferOperation operation : loaded.operations()) {
            if (!operation.success()) {
                continue;
            }
            byKind.merge(operation.kind(), 1L, Long::sum);
            String folder = operation.targetFolder() == null ? "" : operation.targetFolder();
            byFolder.merge(folder, 1L, Long::sum);
            totalBytes += Math.max(0, operation.fileSize());
        }
        return new SessionSummary(loaded.info(), byKind, byFolder, totalBytes, loaded.pending().size());
    }

    /**
     * Deletes ended sessions that started more than {@code age} ago. The open session and
     * unreadable documents are kept.
     */
    public synchronized int cleanupOlderThan(Duration age) throws IOException {
        Instant cutoff = clock.instant().minus(age);
        int removed = 0;
        for (Path file : sessionFiles()) {
            if (isOpen() && file.equals(current.file())) {
                continue;
            }
            SessionInfo info;
            try {
                info = readSession(new AtomicJsonFile(mapper, file)).info();
            } catch (LogCorruptionException e) {
                LOGGER.warn("Leaving unreadable transfer session {} in place: {}", file, e.getMessage());
                continue;
            }
            if (info.startTime() != null && info.startTime().isBefore(cutoff)) {
                Files.deleteIfExists(file);
                removed++;
            }
        }
        if (removed > 0) {
            LOGGER.info("Removed {} transfer sessions older than {}", removed, age);
        }
        return removed;
    }

    /**
     * Undoes the successful operations of a session, or only those with the given ids.
     * Without ids, interrupted operations left as intents are undone too.
     */
    public RestoreReport restore(String session, Collection<Long> operationIds, boolean dryRun) throws IOException {
        return restorer.restore(load(session), operationIds, dryRun);
    }

    private SessionHandle requireOpen() {
        if (current == null) {
            throw new IllegalStateException("No transfer session has been started");
        }
        if (ended) {
            throw new IllegalStateException("Transfer session " + current.name() + " has already ended");
        }
        return current;
    }

    private TransferSession readSession(AtomicJsonFile file) throws IOException {
        TransferSession session = file.read(TransferSession.class)
                .orElseThrow(() -> new LogCorruptionException(file.path(), "session document is empty"));
        if (session.info() == null) {
            throw new LogCorruptionException(file.path(), "session document has no session_info");
        }
        return session;
    }

    private Path resolve(String session) {
        Path candidate = Path.of(session);
        if (candidate.isAbsolute() || candidate.getNameCount() > 1) {
            return candidate;
        }
        return session.endsWith(SUFFIX) ? logDirectory.resolve(session) : sessionFile(session);
    }

    private Path sessionFile(String name) {
        return logDirectory.resolve(name + SUFFIX);
    }

    private List<Path> sessionFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(logDirectory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logDirectory, "*" + SUFFIX)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort(null);
        return files;
    }
}

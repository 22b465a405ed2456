package com.example.fileorganizer.store;

import com.example.fileorganizer.exception.LogCorruptionException;
import com.example.fileorganizer.json.AtomicJsonFile;
import com.example.fileorganizer.model.FileRecord;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only JSON array of {@link ResultEntry}, safe to share between threads and
 * processes. Each append rewrites the whole array through an atomic swap under an
 * in-process lock and an advisory cross-process lock.
 */
public class ResultStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultStore.class);
    private static final int RECENT_ENTRIES = 10;
    private static final Map<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private final AtomicJsonFile file;
    private final Path lockFile;
    private final ObjectMapper mapper;
    private final CrossProcessLock crossProcessLock;
    private final ReentrantLock lock;

    public ResultStore(Path file, ObjectMapper mapper) {
        this(file, mapper, CrossProcessLocks.platformDefault());
    }

    public ResultStore(Path file, ObjectMapper mapper, CrossProcessLock crossProcessLock) {
        this.file = new AtomicJsonFile(mapper, file);
        this.lockFile = this.file.path().resolveSibling(this.file.path().getFileName() + ".lock");
        this.mapper = mapper;
        this.crossProcessLock = crossProcessLock;
        this.lock = LOCKS.computeIfAbsent(this.file.path(), ignored -> new ReentrantLock());
    }

    public Path path() {
        return file.path();
    }

    /**
     * Appends the entry unless one with the same key is already stored.
     *
     * @return true if the entry is stored (now or before), false if the write failed
     * @throws LogCorruptionException if the existing store cannot be parsed; it is left untouched
     */
    public boolean append(ResultEntry entry) throws LogCorruptionException {
        return appendAll(List.of(entry)) >= 0;
    }

    /**
     * Appends the entries whose keys are new, in order.
     *
     * @return the number of entries added, or -1 if the write failed
     * @throws LogCorruptionException if the existing store cannot be parsed; it is left untouched
     */
    public int appendAll(Collection<ResultEntry> entries) throws LogCorruptionException {
        lock.lock();
        try (CrossProcessLock.Handle ignored = acquireCrossProcessLock()) {
            List<ResultEntry> stored = readEntries();
            Set<ResultEntry.DedupKey> keys = new HashSet<>();
            for (ResultEntry existing : stored) {
                keys.add(existing.dedupKey());
            }
            int added = 0;
            for (ResultEntry entry : entries) {
                if (keys.add(entry.dedupKey())) {
                    stored.add(entry);
                    added++;
                } else {
                    LOGGER.info("Skipping duplicate result for {} -> {}", entry.fileName(), entry.finalTargetPath());
                }
            }
            if (added > 0) {
                file.write(stored);
            }
            return added;
        } catch (LogCorruptionException e) {
            LOGGER.error("Refusing to write result store {}: {}", file.path(), e.getMessage());
            throw e;
        } catch (IOException e) {
            LOGGER.error("Failed to write result store {}", file.path(), e);
            return -1;
        } finally {
            lock.unlock();
        }
    }

    public List<ResultEntry> readAll() throws IOException {
        lock.lock();
        try {
            return List.copyOf(readEntries());
        } finally {
            lock.unlock();
        }
    }

    public ResultStatistics statistics() throws IOException {
        List<ResultEntry> entries = readAll();
        int success = 0;
        Map<String, Long> byOperation = new LinkedHashMap<>();
        Map<String, Long> byExtension = new LinkedHashMap<>();
        for (ResultEntry entry : entries) {
            if (entry.success()) {
                success++;
            }
            String operation = entry.operation() == null ? "unknown" : entry.operation().id();
            byOperation.merge(operation, 1L, Long::sum);
            String extension = Optional.ofNullable(entry.metadata())
                    .map(FileRecord::extension)
                    .filter(value -> !value.isEmpty())
                    .orElse("none");
            byExtension.merge(extension, 1L, Long::sum);
        }
        List<ResultEntry> recent = entries.subList(Math.max(0, entries.size() - RECENT_ENTRIES), entries.size());
        return new ResultStatistics(entries.size(), success, entries.size() - success, byOperation, byExtension, recent);
    }

    private CrossProcessLock.Handle acquireCrossProcessLock() throws IOException {
        Files.createDirectories(lockFile.getParent());
        return crossProcessLock.acquire(lockFile);
    }

    private List<ResultEntry> readEntries() throws IOException {
        Optional<JsonNode> tree = file.readTree();
        if (tree.isEmpty()) {
            return new ArrayList<>();
        }
        if (!tree.get().isArray()) {
            throw new LogCorruptionException(file.path(), "result store root is not an array");
        }
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, ResultEntry.class);
        try {
            List<ResultEntry> entries = mapper.convertValue(tree.get(), listType);
            return new ArrayList<>(entries);
        } catch (IllegalArgumentException e) {
            throw new LogCorruptionException(file.path(), "unexpected result entry structure", e);
        }
    }
}

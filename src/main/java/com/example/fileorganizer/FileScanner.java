package com.example.fileorganizer;

import com.example.fileorganizer.extract.FileRecordReader;
import com.example.fileorganizer.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Breadth-first walk of the source directories collecting the files to organize.
 */
public class FileScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileScanner.class);

    private final boolean followLinks;
    private final List<PathMatcher> excludedFiles;
    private final List<PathMatcher> excludedDirectories;
    private final FileRecordReader reader;

    public FileScanner(boolean followLinks, List<String> excludeFilePatterns, List<String> excludeDirectoryPatterns) {
        this.followLinks = followLinks;
        this.excludedFiles = matchers(excludeFilePatterns);
        this.excludedDirectories = matchers(excludeDirectoryPatterns);
        this.reader = new FileRecordReader(followLinks);
    }

    public static FileScanner fromConfig(OrganizerConfig config) {
        return new FileScanner(config.followLinks(), config.excludeFilePatterns(), config.excludeDirectoryPatterns());
    }

    /**
     * Returns the files under the given roots sorted by path, each file once.
     *
     * @throws NoSuchFileException if a root does not exist
     */
    public List<FileRecord> scan(List<Path> roots) throws IOException {
        Map<String, FileRecord> found = new LinkedHashMap<>();
        for (Path root : roots) {
            if (!Files.exists(root, linkOptions())) {
                throw new NoSuchFileException(root.toString(), null, "source directory does not exist");
            }
            if (Files.isRegularFile(root, linkOptions())) {
                FileRecord record = reader.read(root);
                found.putIfAbsent(record.path(), record);
                continue;
            }
            walk(root, found);
        }
        List<FileRecord> records = new ArrayList<>(found.values());
        records.sort(Comparator.comparing(FileRecord::path));
        LOGGER.info("Scanned {} source locations, found {} files", roots.size(), records.size());
        return records;
    }

    private void walk(Path root, Map<String, FileRecord> found) {
        Deque<Path> pending = new ArrayDeque<>();
        pending.addLast(root);
        while (!pending.isEmpty()) {
            Path current = pending.removeFirst();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(current)) {
                for (Path entry : stream) {
                    if (shouldSkipPath(entry)) {
                        continue;
                    }
                    if (Files.isDirectory(entry, linkOptions())) {
                        if (!isExcluded(entry, excludedDirectories)) {
                            pending.addLast(entry);
                        }
                    } else if (Files.isRegularFile(entry, linkOptions())) {
                        if (isExcluded(entry, excludedFiles)) {
                            continue;
                        }
                        try {
                            FileRecord record = reader.read(entry);
                            found.putIfAbsent(record.path(), record);
                        } catch (IOException ex) {
                            LOGGER.warn("Failed to read attributes for {}", entry, ex);
                        }
                    }
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to list directory {}", current, ex);
            }
        }
    }

    private boolean shouldSkipPath(Path path) {
        return !followLinks && Files.isSymbolicLink(path);
    }

    private boolean isExcluded(Path path, List<PathMatcher> matchers) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        for (PathMatcher matcher : matchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    private LinkOption[] linkOptions() {
        return followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
    }

    private static List<PathMatcher> matchers(List<String> patterns) {
        List<PathMatcher> matchers = new ArrayList<>();
        if (patterns == null) {
            return matchers;
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                continue;
            }
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + escapeGlob(pattern)));
        }
        return matchers;
    }

    // '$' and friends are literal in names like $RECYCLE.BIN; only * ? and {} act as wildcards
    private static String escapeGlob(String pattern) {
        StringBuilder escaped = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}

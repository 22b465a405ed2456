package com.example.fileorganizer.classify;

import com.example.fileorganizer.backend.ChatBackend;
import com.example.fileorganizer.classify.ClassificationContext.Stage;
import com.example.fileorganizer.extract.ContentExtractor;
import com.example.fileorganizer.model.ClassificationDecision;
import com.example.fileorganizer.model.ClassificationStatus;
import com.example.fileorganizer.model.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a target tree level by level and picks one child directory per level for a file.
 *
 * <p>Matchers are consulted in order and the first answer wins. The walk ends when the
 * chosen directory has no children (complete), when nothing matches (partial, or unmatched
 * at the first level), or at the depth cap.
 */
public class Classifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(Classifier.class);

    private final List<DirectoryMatcher> matchers;
    private final int maxDepth;

    public Classifier(List<DirectoryMatcher> matchers, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1");
        }
        this.matchers = List.copyOf(matchers);
        this.maxDepth = maxDepth;
    }

    /**
     * The standard chain: temporal, literal, content-assisted (only with a backend), fuzzy.
     */
    public static Classifier create(Optional<ChatBackend> backend,
                                    ContentExtractor extractor,
                                    ClassificationRules rules,
                                    int contentLength,
                                    int summaryLength,
                                    int maxDepth) {
        List<DirectoryMatcher> matchers = new ArrayList<>();
        matchers.add(new TemporalMatcher());
        matchers.add(new LiteralContainmentMatcher());
        backend.ifPresent(chat -> matchers.add(new ContentAssistedMatcher(
                chat, extractor, new SummaryGenerator(chat, summaryLength), rules, contentLength)));
        matchers.add(new FuzzyMatcher());
        return new Classifier(matchers, maxDepth);
    }

    public ClassificationDecision classify(FileRecord file, Path targetRoot) throws IOException {
        return classify(new ClassificationContext(file), targetRoot);
    }

    public ClassificationDecision classify(ClassificationContext context, Path targetRoot) throws IOException {
        if (!Files.isDirectory(targetRoot)) {
            throw new NoSuchFileException(targetRoot.toString(), null, "target root is not a directory");
        }
        long start = System.currentTimeMillis();
        List<String> tags = new ArrayList<>();
        List<String> reasons = new ArrayList<>();
        ClassificationStatus status;

        Path current = targetRoot;
        List<String> candidates = childDirectories(current);
        if (candidates.isEmpty()) {
            reasons.add("target root has no sub-directories");
            status = ClassificationStatus.UNMATCHED;
        } else {
            int level = 1;
            while (true) {
                Optional<LevelMatch> match = firstMatch(new MatchRequest(context, candidates, level, current));
                if (match.isEmpty()) {
                    reasons.add("level " + level + ": no directory matched among " + candidates);
                    status = tags.isEmpty() ? ClassificationStatus.UNMATCHED : ClassificationStatus.PARTIAL;
                    break;
                }
                LevelMatch chosen = match.get();
                tags.add(chosen.directory());
                reasons.add("level " + level + ": " + chosen.reason());
                current = current.resolve(chosen.directory());
                candidates = childDirectories(current);
                if (candidates.isEmpty()) {
                    status = ClassificationStatus.COMPLETE;
                    break;
                }
                if (level >= maxDepth) {
                    reasons.add("stopped at depth " + maxDepth);
                    status = ClassificationStatus.COMPLETE;
                    break;
                }
                level++;
            }
        }

        context.setLevelTags(tags);
        long elapsed = System.currentTimeMillis() - start;
        long backendWork = context.timing(Stage.CONTENT_EXTRACTION) + context.timing(Stage.SUMMARY);
        context.recordTiming(Stage.RECOMMENDATION, Math.max(0, elapsed - backendWork));

        ClassificationDecision decision = ClassificationDecision.of(
                tags, String.join("; ", reasons), status, context.summary(), context.backendDegraded());
        LOGGER.debug("Classified {} as '{}' ({})", context.file().name(), decision.relativePath(), status);
        return decision;
    }

    List<DirectoryMatcher> matchers() {
        return matchers;
    }

    private Optional<LevelMatch> firstMatch(MatchRequest request) {
        for (DirectoryMatcher matcher : matchers) {
            Optional<LevelMatch> match = matcher.tryMatch(request);
            if (match.isPresent() && request.candidates().contains(match.get().directory())) {
                LOGGER.debug("Level {} of {} matched by {}: {}",
                        request.level(), request.fileName(), matcher.name(), match.get().directory());
                return match;
            }
        }
        return Optional.empty();
    }

    static List<String> childDirectories(Path directory) throws IOException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, Files::isDirectory)) {
            for (Path child : stream) {
                names.add(child.getFileName().toString());
            }
        } catch (NotDirectoryException | NoSuchFileException e) {
            return List.of();
        }
        names.sort(null);
        return names;
    }
}

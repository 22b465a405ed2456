package com.example.fileorganizer.classify;

import java.util.Locale;
import java.util.Optional;

/**
 * Picks the candidate whose name occurs in the file name, preferring the longest one.
 */
public class LiteralContainmentMatcher implements DirectoryMatcher {

    @Override
    public Optional<LevelMatch> tryMatch(MatchRequest request) {
        String fileName = request.fileName().toLowerCase(Locale.ROOT);
        String best = null;
        for (String candidate : request.candidates()) {
            String needle = candidate.toLowerCase(Locale.ROOT);
            if (needle.isBlank() || !fileName.contains(needle)) {
                continue;
            }
            if (best == null || candidate.length() > best.length()) {
                best = candidate;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new LevelMatch(best, "file name contains directory name " + best));
    }

    @Override
    public String name() {
        return "literal";
    }
}

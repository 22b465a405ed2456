package com.example.fileorganizer.classify;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Last resort: a keyword of the candidate name found in the file name or its summary.
 * Never calls the backend; it only reuses a summary already generated for the file.
 */
public class FuzzyMatcher implements DirectoryMatcher {
    private static final Pattern KEYWORD_SEPARATORS = Pattern.compile("[\\s_\\-]+");
    private static final int MIN_KEYWORD_LENGTH = 3;

    @Override
    public Optional<LevelMatch> tryMatch(MatchRequest request) {
        String text = (request.fileName() + " " + request.context().summary()).toLowerCase(Locale.ROOT);
        for (String candidate : request.candidates()) {
            for (String keyword : KEYWORD_SEPARATORS.split(candidate.toLowerCase(Locale.ROOT))) {
                if (keyword.length() >= MIN_KEYWORD_LENGTH && text.contains(keyword)) {
                    return Optional.of(new LevelMatch(candidate,
                            "keyword '" + keyword + "' matches directory " + candidate));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return "fuzzy";
    }
}

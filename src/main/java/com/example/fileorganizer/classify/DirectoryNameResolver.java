package com.example.fileorganizer.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps a free-text backend answer onto exactly one of the offered directory names.
 * Anything that cannot be mapped unambiguously is rejected.
 */
final class DirectoryNameResolver {
    private static final Pattern LIST_NUMBERING = Pattern.compile("^\\d+\\s*[.、)）:]?\\s*");
    private static final Pattern WRAPPING = Pattern.compile("^[\\s\"'`“”‘’*\\-]+|[\\s\"'`“”‘’*.。,，;；]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private DirectoryNameResolver() {
    }

    static Optional<String> resolve(String answer, List<String> candidates) {
        if (answer == null || answer.isBlank()) {
            return Optional.empty();
        }
        String firstLine = answer.strip().lines().findFirst().orElse("");
        Optional<String> direct = matchExactly(WRAPPING.matcher(firstLine).replaceAll(""), candidates);
        if (direct.isPresent()) {
            return direct;
        }
        String cleaned = WRAPPING.matcher(LIST_NUMBERING.matcher(firstLine.strip()).replaceFirst("")).replaceAll("");
        Optional<String> numbered = matchExactly(cleaned, candidates);
        if (numbered.isPresent()) {
            return numbered;
        }
        return containedIn(cleaned, candidates);
    }

    private static Optional<String> matchExactly(String value, List<String> candidates) {
        if (value.isEmpty()) {
            return Optional.empty();
        }
        for (String candidate : candidates) {
            if (candidate.equals(value)) {
                return Optional.of(candidate);
            }
        }
        for (String candidate : candidates) {
            if (candidate.equalsIgnoreCase(value)) {
                return Optional.of(candidate);
            }
        }
        String compact = compact(value);
        for (String candidate : candidates) {
            if (compact(candidate).equals(compact)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    // accepted only when a single candidate is mentioned
    private static Optional<String> containedIn(String value, List<String> candidates) {
        String lower = value.toLowerCase(Locale.ROOT);
        List<String> mentioned = new ArrayList<>();
        for (String candidate : candidates) {
            if (!candidate.isBlank() && lower.contains(candidate.toLowerCase(Locale.ROOT))) {
                mentioned.add(candidate);
            }
        }
        return mentioned.size() == 1 ? Optional.of(mentioned.get(0)) : Optional.empty();
    }

    private static String compact(String value) {
        return WHITESPACE.matcher(value).replaceAll("").toLowerCase(Locale.ROOT);
    }
}

package com.example.fileorganizer.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the candidate that carries the same year as the file name.
 */
public class TemporalMatcher implements DirectoryMatcher {
    private static final Pattern YEAR = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})");

    @Override
    public Optional<LevelMatch> tryMatch(MatchRequest request) {
        List<String> fileYears = years(request.fileName());
        for (String year : fileYears) {
            for (String candidate : request.candidates()) {
                if (years(candidate).contains(year)) {
                    return Optional.of(new LevelMatch(candidate,
                            "year " + year + " in file name matches directory " + candidate));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return "temporal";
    }

    static List<String> years(String text) {
        List<String> years = new ArrayList<>();
        Matcher matcher = YEAR.matcher(text);
        while (matcher.find()) {
            years.add(matcher.group(1));
        }
        return years;
    }
}

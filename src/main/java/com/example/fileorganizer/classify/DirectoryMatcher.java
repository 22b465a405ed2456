package com.example.fileorganizer.classify;

import java.util.Optional;

/**
 * One heuristic in the ordered chain that picks a child directory at a given level.
 */
public interface DirectoryMatcher {
    /**
     * Returns the chosen candidate, or empty to let the next matcher try.
     */
    Optional<LevelMatch> tryMatch(MatchRequest request);

    String name();
}

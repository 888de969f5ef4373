package com.project.hatchmark.match;

import java.util.List;
import java.util.Optional;

/**
 * Ranked result of a similarity query.
 *
 * @param matches    entries at or above the threshold, best first
 * @param exactMatch first entry at distance 0, if any
 * @param corpusSize number of entries scanned
 */
public record MatchReport<T>(List<Match<T>> matches, Optional<Match<T>> exactMatch, int corpusSize) {

    public MatchReport {
        matches = List.copyOf(matches);
    }

    public boolean isOriginal() {
        return matches.isEmpty();
    }

    public Optional<Match<T>> best() {
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }
}

package com.project.hatchmark.match;

import com.project.hatchmark.core.InputValidator;
import com.project.hatchmark.fingerprint.Fingerprint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ranks a corpus against a candidate fingerprint.
 *
 * <p>Ordering: similarity descending, then {@code createdAt} ascending (the earliest registration
 * wins a tie), then id so the order is total. Entries whose fingerprint width differs from the
 * candidate's are never reported, whatever the threshold.
 */
public final class SimilarityMatcher {

    /** Bar for "this image is already registered" when registering. */
    public static final int DEFAULT_REGISTER_THRESHOLD = 90;

    /** Bar for listing candidates when verifying an image. */
    public static final int DEFAULT_VERIFY_THRESHOLD = 70;

    private static final Comparator<Match<?>> RANKING = Comparator
            .comparingInt((Match<?> m) -> m.similarity()).reversed()
            .thenComparing(m -> m.entry().createdAt())
            .thenComparing(m -> m.entry().id());

    private SimilarityMatcher() {
    }

    public static <T> MatchReport<T> match(Fingerprint candidate, List<CorpusEntry<T>> corpus, int threshold) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(corpus, "corpus must not be null");
        InputValidator.validateRange(threshold, 0, 100, "threshold");

        List<Match<T>> matches = new ArrayList<>();
        for (CorpusEntry<T> entry : corpus) {
            if (entry.fingerprint().bitWidth() != candidate.bitWidth()) {
                // incomparable scheme, never a match
                continue;
            }
            int distance = HammingDistance.between(candidate, entry.fingerprint());
            int similarity = HammingDistance.similarity(distance, candidate.bitWidth());
            if (similarity >= threshold) {
                matches.add(new Match<>(entry, similarity, distance));
            }
        }
        matches.sort(RANKING);

        Optional<Match<T>> exact = matches.stream().filter(Match::isExact).findFirst();
        return new MatchReport<>(matches, exact, corpus.size());
    }
}

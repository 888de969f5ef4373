package com.project.hatchmark.match;

import com.project.hatchmark.fingerprint.Fingerprint;

/**
 * Searchable set of registered fingerprints.
 *
 * <p>{@link LinearScanIndex} is the reference implementation. A sublinear structure (a BK-tree
 * keyed by Hamming distance, or bucketed LSH over hash bands) can replace it without changing
 * callers as long as it returns the same ranked report.
 */
public interface SimilarityIndex<T> {

    void add(CorpusEntry<T> entry);

    int size();

    /**
     * @param threshold minimum similarity percentage (inclusive), 0-100
     */
    MatchReport<T> query(Fingerprint candidate, int threshold);
}

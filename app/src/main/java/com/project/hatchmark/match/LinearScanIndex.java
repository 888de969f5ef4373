package com.project.hatchmark.match;

import com.project.hatchmark.fingerprint.Fingerprint;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * O(n) scan over every entry. Adequate until the corpus grows past a few hundred thousand
 * registrations.
 */
public class LinearScanIndex<T> implements SimilarityIndex<T> {

    private final List<CorpusEntry<T>> entries = new CopyOnWriteArrayList<>();

    public LinearScanIndex() {
    }

    public LinearScanIndex(Collection<CorpusEntry<T>> initial) {
        entries.addAll(initial);
    }

    @Override
    public void add(CorpusEntry<T> entry) {
        entries.add(entry);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public MatchReport<T> query(Fingerprint candidate, int threshold) {
        return SimilarityMatcher.match(candidate, new ArrayList<>(entries), threshold);
    }
}

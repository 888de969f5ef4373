package com.project.hatchmark.match;

/**
 * A corpus entry scored against a candidate.
 *
 * @param entry      the matched corpus entry
 * @param similarity 0-100
 * @param distance   Hamming distance in bits
 */
public record Match<T>(CorpusEntry<T> entry, int similarity, int distance) {

    public String id() {
        return entry.id();
    }

    public boolean isExact() {
        return distance == 0;
    }
}

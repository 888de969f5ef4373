package com.project.hatchmark.match;

import com.project.hatchmark.fingerprint.Fingerprint;

import java.time.Instant;
import java.util.Objects;

/**
 * One registered fingerprint in the corpus being searched.
 *
 * @param id        certificate id
 * @param fingerprint registered fingerprint
 * @param createdAt registration time, used to break similarity ties (earliest first)
 * @param payload   caller data returned with a match (typically the off-chain registration row)
 */
public record CorpusEntry<T>(String id, Fingerprint fingerprint, Instant createdAt, T payload) {

    public CorpusEntry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }
}

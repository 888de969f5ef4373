package com.project.hatchmark.ledger;

import com.project.hatchmark.fingerprint.Fingerprint;

import java.time.Instant;

/**
 * Registration certificate. Owned by its creator, immutable, never deleted.
 */
public record Certificate(
        String id,
        Fingerprint imageHash,
        String creator,
        Instant createdAt,
        String title,
        String description
) {

    public boolean isOwnedBy(String address) {
        return creator.equalsIgnoreCase(address);
    }
}

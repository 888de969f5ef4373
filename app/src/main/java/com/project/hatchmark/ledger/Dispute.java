package com.project.hatchmark.ledger;

import com.project.hatchmark.fingerprint.Fingerprint;

import java.time.Instant;

/**
 * Staked claim that {@code flaggedHash} infringes certificate {@code originalCertId}.
 *
 * @param similarityScore Hamming distance byte, 0 = identical
 * @param stake           amount escrowed while the dispute is open
 * @param version         bumped on every state change; resolution is a compare-and-set on it
 */
public record Dispute(
        String id,
        String originalCertId,
        Fingerprint flaggedHash,
        String flagger,
        int similarityScore,
        DisputeStatus status,
        long stake,
        Instant createdAt,
        long version
) {

    public boolean isOpen() {
        return status == DisputeStatus.OPEN;
    }

    Dispute transitionTo(DisputeStatus next) {
        return new Dispute(id, originalCertId, flaggedHash, flagger, similarityScore, next, stake, createdAt, version + 1);
    }
}

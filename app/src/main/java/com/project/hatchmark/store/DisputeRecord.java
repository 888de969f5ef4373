package com.project.hatchmark.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.project.hatchmark.ledger.DisputeStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Off-chain copy of a dispute. {@code status} is the latest status the store has seen, from
 * either the dispute event or its resolution.
 */
public record DisputeRecord(
        @JsonProperty("dispute_id") String disputeId,
        @JsonProperty("original_cert_id") String originalCertId,
        @JsonProperty("flagged_hash") String flaggedHash,
        @JsonProperty("flagger") String flagger,
        @JsonProperty("similarity_score") int similarityScore,
        @JsonProperty("status") DisputeStatus status,
        @JsonProperty("stake") long stake,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("tx_digest") String txDigest,
        @JsonProperty("synced_at") Instant syncedAt
) {

    public DisputeRecord {
        Objects.requireNonNull(disputeId, "disputeId must not be null");
        Objects.requireNonNull(originalCertId, "originalCertId must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public boolean sameContentAs(DisputeRecord other) {
        return other != null && equals(other.withSyncedAt(syncedAt));
    }

    public DisputeRecord withSyncedAt(Instant value) {
        return new DisputeRecord(disputeId, originalCertId, flaggedHash, flagger, similarityScore, status,
                stake, createdAt, txDigest, value);
    }

    public DisputeRecord withStatus(DisputeStatus value) {
        return new DisputeRecord(disputeId, originalCertId, flaggedHash, flagger, similarityScore, value,
                stake, createdAt, txDigest, syncedAt);
    }
}

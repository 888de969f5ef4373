package com.project.hatchmark.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.project.hatchmark.ledger.DisputeStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * Off-chain copy of a dispute resolution, keyed by dispute id.
 */
public record ResolutionRecord(
        @JsonProperty("dispute_id") String disputeId,
        @JsonProperty("original_cert_id") String originalCertId,
        @JsonProperty("status") DisputeStatus status,
        @JsonProperty("resolver") String resolver,
        @JsonProperty("stake_recipient") String stakeRecipient,
        @JsonProperty("resolved_at") Instant resolvedAt,
        @JsonProperty("tx_digest") String txDigest,
        @JsonProperty("synced_at") Instant syncedAt
) {

    public ResolutionRecord {
        Objects.requireNonNull(disputeId, "disputeId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("a resolution must carry a terminal status, got " + status);
        }
    }

    public boolean sameContentAs(ResolutionRecord other) {
        return other != null && equals(other.withSyncedAt(syncedAt));
    }

    public ResolutionRecord withSyncedAt(Instant value) {
        return new ResolutionRecord(disputeId, originalCertId, status, resolver, stakeRecipient, resolvedAt,
                txDigest, value);
    }
}

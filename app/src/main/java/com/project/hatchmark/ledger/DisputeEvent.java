package com.project.hatchmark.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Emitted by {@code flag}.
 */
public record DisputeEvent(
        @JsonProperty("dispute_id") String disputeId,
        @JsonProperty("original_cert_id") String originalCertId,
        @JsonProperty("flagged_hash") String flaggedHash,
        @JsonProperty("flagger") String flagger,
        @JsonProperty("similarity_score") int similarityScore,
        @JsonProperty("stake") long stake,
        @JsonProperty("timestamp") long timestamp
) {

    static DisputeEvent of(Dispute dispute) {
        return new DisputeEvent(
                dispute.id(),
                dispute.originalCertId(),
                dispute.flaggedHash().hex(),
                dispute.flagger(),
                dispute.similarityScore(),
                dispute.stake(),
                dispute.createdAt().toEpochMilli());
    }
}

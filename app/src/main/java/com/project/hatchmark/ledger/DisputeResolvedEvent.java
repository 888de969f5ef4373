package com.project.hatchmark.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Emitted by {@code resolve}.
 *
 * @param status         {@link DisputeStatus#code()} of the terminal state
 * @param stakeRecipient flagger when upheld, creator when rejected
 */
public record DisputeResolvedEvent(
        @JsonProperty("dispute_id") String disputeId,
        @JsonProperty("original_cert_id") String originalCertId,
        @JsonProperty("status") int status,
        @JsonProperty("resolver") String resolver,
        @JsonProperty("stake_recipient") String stakeRecipient,
        @JsonProperty("timestamp") long timestamp
) {
}

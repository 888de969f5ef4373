package com.project.hatchmark.core;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Either {@code similarity} (0-100) or {@code hammingDistance} (0-255) must be present;
 * {@code hammingDistance} wins when both are.
 */
public record FlagRequest(
        @JsonProperty("cert_id") @JsonAlias("originalCertId") String certId,
        @JsonProperty("flagged_hash") @JsonAlias("flaggedHash") String flaggedHash,
        @JsonProperty("similarity") @JsonAlias("similarityScore") Integer similarity,
        @JsonProperty("hammingDistance") Integer hammingDistance,
        @JsonProperty("stake") Long stake,
        @JsonProperty("sender") String sender
) {
}

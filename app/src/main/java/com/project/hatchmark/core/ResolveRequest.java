package com.project.hatchmark.core;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param resolution {@code VALID} upholds the dispute, {@code INVALID} rejects it
 */
public record ResolveRequest(
        @JsonProperty("dispute_id") String disputeId,
        @JsonProperty("cert_id") String certId,
        @JsonProperty("resolution") String resolution,
        @JsonProperty("sender") String sender
) {
}

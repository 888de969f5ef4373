package com.project.hatchmark.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Position in an event stream: the id of the last event consumed.
 */
public record EventCursor(
        @JsonProperty("txDigest") String txDigest,
        @JsonProperty("eventSeq") long eventSeq
) {

    public EventCursor {
        Objects.requireNonNull(txDigest, "txDigest must not be null");
    }

    @Override
    public String toString() {
        return txDigest + "#" + eventSeq;
    }
}

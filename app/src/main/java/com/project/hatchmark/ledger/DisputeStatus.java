package com.project.hatchmark.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Dispute lifecycle. {@code OPEN} is the only non-terminal state.
 */
public enum DisputeStatus {
    OPEN(0),
    VALID(1),
    INVALID(2);

    private final int code;

    DisputeStatus(int code) {
        this.code = code;
    }

    /** Wire value stored on-chain and in the off-chain {@code disputes.status} column. */
    @JsonValue
    public int code() {
        return code;
    }

    public boolean isTerminal() {
        return this != OPEN;
    }

    @JsonCreator
    public static DisputeStatus fromCode(int code) {
        for (DisputeStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown dispute status code: " + code);
    }
}

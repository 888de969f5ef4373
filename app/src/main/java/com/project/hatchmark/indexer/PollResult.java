package com.project.hatchmark.indexer;

import com.project.hatchmark.ledger.EventType;

/**
 * Outcome of a single poll of one event type.
 */
public record PollResult(EventType type, Outcome outcome, int persisted, int skipped, boolean hasMore) {

    public enum Outcome {
        /** Page persisted (possibly empty) and cursor saved. */
        OK,
        /** Feed query failed; cursor unchanged. */
        RPC_FAILED,
        /** A record or the cursor could not be written; cursor unchanged. */
        STORE_FAILED,
        /** Circuit open for this type; nothing attempted. */
        PAUSED
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }
}

package com.project.hatchmark.indexer;

import com.project.hatchmark.core.CircuitBreaker;
import com.project.hatchmark.ledger.EventCursor;
import com.project.hatchmark.ledger.EventType;

import java.time.Instant;

/**
 * Point-in-time view of one event type's loop.
 *
 * @param lastHealthyPoll last poll that completed without an RPC or store failure
 * @param stalled         the cursor has been held back for longer than the alert window
 */
public record IndexerStatus(
        EventType type,
        EventCursor cursor,
        long indexed,
        long skipped,
        Instant lastHealthyPoll,
        String lastError,
        CircuitBreaker.State circuit,
        boolean stalled
) {
}

package com.project.hatchmark.ledger;

import com.project.hatchmark.core.LedgerException;

/**
 * Ordered, replayable event log per {@link EventType}.
 */
public interface EventFeed {

    /**
     * Events strictly after {@code after} ({@code null} = from the beginning), oldest first.
     *
     * @throws LedgerException when the ledger cannot be reached or rejects the query
     */
    EventPage queryEvents(EventType type, EventCursor after, int limit);
}

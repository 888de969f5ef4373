package com.project.hatchmark.store;

import com.project.hatchmark.ledger.EventCursor;
import com.project.hatchmark.ledger.EventType;

import java.util.Optional;

/**
 * Durable indexer positions, one per event type. Shared by every indexer instance.
 */
public interface CursorStore {

    Optional<EventCursor> loadCursor(EventType type);

    /**
     * Move the cursor of {@code type} to {@code next}, but only if it still equals {@code expected}.
     * A {@code null} {@code expected} means no cursor has been stored yet.
     *
     * @return {@code false} when another writer moved the cursor first; nothing is written
     */
    boolean advanceCursor(EventType type, EventCursor expected, EventCursor next);
}

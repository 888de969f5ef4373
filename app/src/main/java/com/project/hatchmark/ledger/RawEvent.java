package com.project.hatchmark.ledger;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Event as delivered by the feed. {@code parsedJson} is deliberately untyped: the indexer
 * decides whether its shape is usable.
 */
public record RawEvent(EventCursor id, EventType type, JsonNode parsedJson, long timestampMs) {
}

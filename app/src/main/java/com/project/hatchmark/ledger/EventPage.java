package com.project.hatchmark.ledger;

import java.util.List;

/**
 * One page of an event stream, oldest first.
 *
 * @param nextCursor cursor to pass on the next query; the id of the last event in {@code data},
 *                   or the query cursor when the page is empty
 */
public record EventPage(List<RawEvent> data, EventCursor nextCursor, boolean hasNextPage) {

    public EventPage {
        data = List.copyOf(data);
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }
}

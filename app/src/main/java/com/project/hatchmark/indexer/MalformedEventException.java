package com.project.hatchmark.indexer;

import com.project.hatchmark.ledger.RawEvent;

/**
 * An event whose payload does not have the expected shape. The indexer logs and skips it.
 */
public class MalformedEventException extends RuntimeException {

    private final transient RawEvent event;

    public MalformedEventException(RawEvent event, String message, Throwable cause) {
        super("malformed " + event.type().structName() + " " + event.id() + ": " + message, cause);
        this.event = event;
    }

    public RawEvent event() {
        return event;
    }
}

package com.project.hatchmark.ledger;

/**
 * Event streams emitted by the registry module. Each stream is paged and cursored independently.
 */
public enum EventType {
    REGISTRATION("RegistrationEvent"),
    DISPUTE("DisputeEvent"),
    DISPUTE_RESOLVED("DisputeResolvedEvent");

    public static final String MODULE = "registry";

    private final String structName;

    EventType(String structName) {
        this.structName = structName;
    }

    public String structName() {
        return structName;
    }

    /**
     * Fully qualified Move event type, e.g. {@code 0x65c2...::registry::RegistrationEvent}.
     */
    public String qualifiedName(String packageId) {
        return packageId + "::" + MODULE + "::" + structName;
    }
}

package com.pathway.impact.error;

/**
 * Inconsistent reference data, such as a zero-sized pathway or a cycle in the
 * raw hierarchy. Components catch it, skip the offending entity and keep going.
 */
public class DataIntegrityException extends PathwayImpactException {

    private final String entityId;

    public DataIntegrityException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    public DataIntegrityException(String entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}

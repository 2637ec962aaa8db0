package com.pathway.impact.hierarchy;

import com.pathway.impact.error.DataIntegrityException;

import java.util.Objects;

/**
 * A reference-data problem that was absorbed rather than raised: the offending entity
 * was skipped and the run went on.
 */
public record DataIntegrityIssue(String entityId, String message) {

    public DataIntegrityIssue {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(message, "message is required");
    }

    public static DataIntegrityIssue from(DataIntegrityException e) {
        return new DataIntegrityIssue(e.getEntityId(), e.getMessage());
    }

    public String describe() {
        return entityId + ": " + message;
    }
}

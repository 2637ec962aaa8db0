package com.pathway.impact.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable operation.
 *
 * @param subjectId the analysis, share or hierarchy release the action concerns
 * @param actorId   caller identity, or null for system actions
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String subjectId,
        String actorId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AuditEntry of(AuditAction action, String subjectId, String actorId,
                                Map<String, Object> details, Instant timestamp) {
        return new AuditEntry(UUID.randomUUID().toString(), action, subjectId, actorId, details, timestamp);
    }
}

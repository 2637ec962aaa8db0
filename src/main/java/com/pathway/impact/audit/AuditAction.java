package com.pathway.impact.audit;

/**
 * Auditable operations of the engine.
 */
public enum AuditAction {
    ANALYSIS_COMPLETED,
    ANALYSIS_FAILED,
    COMPARISON_COMPLETED,
    SHARE_CREATED,
    HIERARCHY_PUBLISHED
}

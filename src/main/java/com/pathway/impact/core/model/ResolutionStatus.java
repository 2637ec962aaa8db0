package com.pathway.impact.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of resolving a free-text compound query.
 */
public enum ResolutionStatus {
    RESOLVED,
    AMBIGUOUS,
    NOT_FOUND;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

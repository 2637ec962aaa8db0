package com.pathway.impact.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a query matched a compound record. Declaration order is ranking order:
 * an exact display-name match outranks a synonym match, which outranks a substring match.
 */
public enum MatchKind {
    EXACT_NAME("exact_name_match"),
    SYNONYM("synonym_match"),
    SUBSTRING("substring_match");

    private final String reason;

    MatchKind(String reason) {
        this.reason = reason;
    }

    @JsonValue
    public String reason() {
        return reason;
    }

    /**
     * Returns true for exact or synonym matches, which take precedence over substring hits.
     */
    public boolean isDirect() {
        return this != SUBSTRING;
    }
}

package com.pathway.impact.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Evidence state that never collapses "not tested" into "no".
 */
public enum TriState {
    POSITIVE,
    NEGATIVE,
    UNKNOWN;

    public static TriState of(boolean value) {
        return value ? POSITIVE : NEGATIVE;
    }

    public boolean isPositive() {
        return this == POSITIVE;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

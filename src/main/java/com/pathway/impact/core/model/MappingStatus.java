package com.pathway.impact.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether a target maps onto a gene product of the pathway hierarchy.
 */
public enum MappingStatus {
    /** Primary gene product found in the hierarchy. */
    MAPPED,
    /** Found only through a secondary (alias) mapping. */
    PARTIAL,
    /** No mapping; shown to the user but excluded from pathway scoring. */
    UNMAPPED;

    public boolean isScorable() {
        return this != UNMAPPED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

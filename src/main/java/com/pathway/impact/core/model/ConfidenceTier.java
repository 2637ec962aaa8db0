package com.pathway.impact.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Confidence tier of a per-target potency estimate.
 */
public enum ConfidenceTier {
    LOW(0),
    MEDIUM(1),
    HIGH(2);

    private final int rank;

    ConfidenceTier(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public boolean isAtLeast(ConfidenceTier other) {
        return rank >= other.rank;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

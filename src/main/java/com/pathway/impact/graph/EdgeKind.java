package com.pathway.impact.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EdgeKind {
    DRUG_TARGET,
    TARGET_PATHWAY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

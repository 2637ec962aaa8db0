package com.pathway.impact.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NodeKind {
    DRUG,
    TARGET,
    PATHWAY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Deterministic node id: {@code <kind>:<entityId>}.
     */
    public String nodeId(String entityId) {
        return wireName() + ":" + entityId;
    }
}

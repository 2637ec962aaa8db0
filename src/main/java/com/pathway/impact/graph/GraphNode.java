package com.pathway.impact.graph;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A drug, target or pathway vertex of the association graph.
 *
 * @param metadata display attributes, rendered as strings and kept in key order
 */
public record GraphNode(String id, String label, NodeKind kind, Map<String, String> metadata) {

    public GraphNode {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(kind, "kind is required");
        label = label != null ? label : id;
        metadata = metadata != null ? Collections.unmodifiableMap(new TreeMap<>(metadata)) : Map.of();
    }
}

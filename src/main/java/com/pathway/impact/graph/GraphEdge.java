package com.pathway.impact.graph;

import java.util.Objects;

/**
 * @param weight median potency for drug-target edges, pathway score for target-pathway edges
 */
public record GraphEdge(String id, String source, String target, EdgeKind kind, double weight) {

    public GraphEdge {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(kind, "kind is required");
    }
}

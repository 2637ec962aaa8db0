package com.pathway.impact.graph;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drug, target and pathway nodes with the edges between them. Every edge endpoint is
 * a node of the graph.
 */
public record AssociationGraph(List<GraphNode> nodes, List<GraphEdge> edges) {

    public AssociationGraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
        Set<String> ids = new HashSet<>();
        for (GraphNode node : nodes) {
            if (!ids.add(node.id())) {
                throw new IllegalArgumentException("Duplicate node id " + node.id());
            }
        }
        for (GraphEdge edge : edges) {
            if (!ids.contains(edge.source()) || !ids.contains(edge.target())) {
                throw new IllegalArgumentException("Edge " + edge.id() + " references a missing node");
            }
        }
    }

    public static AssociationGraph empty() {
        return new AssociationGraph(List.of(), List.of());
    }
}

package com.pathway.impact.core.model;

import java.util.Objects;
import java.util.Set;

/**
 * A node of the collapsed pathway hierarchy.
 *
 * @param depth       shortest root-to-node distance, roots at depth 1
 * @param geneSetSize number of gene products annotated to the pathway
 * @param ancestorIds every ancestor on the collapsed tree path
 * @param childIds    direct children on the collapsed tree
 */
public record PathwayNode(
        String id,
        String name,
        int depth,
        int geneSetSize,
        Set<String> ancestorIds,
        Set<String> childIds
) {
    public PathwayNode {
        Objects.requireNonNull(id, "id is required");
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1");
        }
        name = name != null ? name : id;
        ancestorIds = ancestorIds != null ? Set.copyOf(ancestorIds) : Set.of();
        childIds = childIds != null ? Set.copyOf(childIds) : Set.of();
    }
}

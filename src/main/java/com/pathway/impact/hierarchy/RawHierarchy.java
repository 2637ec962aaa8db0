package com.pathway.impact.hierarchy;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hierarchy data as pulled from the pathway source, before collapsing.
 */
public record RawHierarchy(List<RawPathway> pathways, List<Relation> relations, Map<String, String> geneSymbolAliases) {

    public RawHierarchy {
        pathways = pathways != null ? List.copyOf(pathways) : List.of();
        relations = relations != null ? List.copyOf(relations) : List.of();
        geneSymbolAliases = geneSymbolAliases != null ? Map.copyOf(geneSymbolAliases) : Map.of();
    }

    /**
     * @param geneSetSize reported size; may exceed {@code geneProductIds.size()}
     */
    public record RawPathway(String id, String name, int geneSetSize, Set<String> geneProductIds) {
        public RawPathway {
            geneProductIds = geneProductIds != null ? Set.copyOf(geneProductIds) : Set.of();
        }
    }

    public record Relation(String parentId, String childId) {
    }
}

package com.pathway.impact.hierarchy;

import com.pathway.impact.core.model.MappingStatus;
import com.pathway.impact.core.model.PathwayNode;
import com.pathway.impact.core.model.TargetAnnotation;
import com.pathway.impact.error.DataIntegrityException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable, point-in-time pathway hierarchy, already collapsed to a tree.
 * Built by {@link HierarchySnapshotBuilder} and published through {@link HierarchyRegistry};
 * every scoring call receives one snapshot and reads nothing else.
 */
public final class HierarchySnapshot {

    private final String releaseTag;
    private final Map<String, PathwayNode> nodes;
    private final Map<String, Set<String>> geneSets;
    private final Map<String, SortedSet<String>> pathwaysByGeneProduct;
    private final Map<String, String> geneSymbolAliases;
    private final List<DataIntegrityIssue> integrityIssues;

    HierarchySnapshot(String releaseTag,
                      Map<String, PathwayNode> nodes,
                      Map<String, Set<String>> geneSets,
                      Map<String, SortedSet<String>> pathwaysByGeneProduct,
                      Map<String, String> geneSymbolAliases,
                      List<DataIntegrityIssue> integrityIssues) {
        this.releaseTag = releaseTag;
        this.nodes = Map.copyOf(nodes);
        this.geneSets = Map.copyOf(geneSets);
        this.pathwaysByGeneProduct = Map.copyOf(pathwaysByGeneProduct);
        this.geneSymbolAliases = Map.copyOf(geneSymbolAliases);
        this.integrityIssues = List.copyOf(integrityIssues);
    }

    public static HierarchySnapshotBuilder builder(String releaseTag) {
        return new HierarchySnapshotBuilder(releaseTag);
    }

    public String releaseTag() {
        return releaseTag;
    }

    public boolean contains(String pathwayId) {
        return nodes.containsKey(pathwayId);
    }

    public Optional<PathwayNode> node(String pathwayId) {
        return Optional.ofNullable(nodes.get(pathwayId));
    }

    public Set<String> ancestorsOf(String pathwayId) {
        return require(pathwayId).ancestorIds();
    }

    public Set<String> childrenOf(String pathwayId) {
        return require(pathwayId).childIds();
    }

    public Set<String> geneSet(String pathwayId) {
        require(pathwayId);
        return geneSets.getOrDefault(pathwayId, Set.of());
    }

    public int depth(String pathwayId) {
        return require(pathwayId).depth();
    }

    /**
     * Pathways whose gene set contains the gene product, in ascending id order.
     */
    public SortedSet<String> pathwaysContaining(String geneProductId) {
        SortedSet<String> ids = pathwaysByGeneProduct.get(geneProductId);
        return ids != null ? Collections.unmodifiableSortedSet(ids) : Collections.emptySortedSet();
    }

    /**
     * Places a target onto a gene product of this hierarchy. The primary gene product is
     * tried first; failing that, the gene symbol is looked up in the secondary alias table.
     */
    public GeneProductMapping mapTarget(TargetAnnotation annotation) {
        List<String> notes = new ArrayList<>();
        String primary = annotation.geneProductId();
        if (primary != null && pathwaysByGeneProduct.containsKey(primary)) {
            notes.add(GeneProductMapping.PRIMARY_NOTE);
            return new GeneProductMapping(MappingStatus.MAPPED, primary, notes);
        }
        notes.add(primary == null ? "no_primary_gene_product" : "primary_gene_product_not_in_hierarchy");

        String symbol = annotation.geneSymbol();
        if (symbol != null) {
            String alias = geneSymbolAliases.get(symbol.toUpperCase(Locale.ROOT));
            if (alias != null && pathwaysByGeneProduct.containsKey(alias)) {
                notes.add(GeneProductMapping.SECONDARY_NOTE);
                notes.add("gene_symbol_alias:" + symbol.toUpperCase(Locale.ROOT));
                return new GeneProductMapping(MappingStatus.PARTIAL, alias, notes);
            }
        }
        notes.add("unmapped");
        return new GeneProductMapping(MappingStatus.UNMAPPED, null, notes);
    }

    public SortedSet<String> pathwayIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(nodes.keySet()));
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Problems found while building this snapshot (cycles, dangling relations, ...).
     */
    public List<DataIntegrityIssue> integrityIssues() {
        return integrityIssues;
    }

    private PathwayNode require(String pathwayId) {
        PathwayNode node = nodes.get(pathwayId);
        if (node == null) {
            throw new DataIntegrityException(pathwayId,
                    "Pathway " + pathwayId + " is not in hierarchy release " + releaseTag);
        }
        return node;
    }
}

package com.pathway.impact.hierarchy;

import com.pathway.impact.core.model.PathwayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collapses raw pathway relations into a {@link HierarchySnapshot}.
 *
 * <p>Raw relations may give a pathway several parents, or contain cycles. The builder
 * keeps one tree parent per pathway: a breadth-first walk from the roots (depth 1) assigns
 * each pathway its shortest root distance, and among parents at that distance the smallest
 * parent id wins. Pathways no root can reach (pure cycles) are dropped and reported as
 * {@link DataIntegrityIssue}s.</p>
 */
public class HierarchySnapshotBuilder {
    private static final Logger log = LoggerFactory.getLogger(HierarchySnapshotBuilder.class);

    private final String releaseTag;
    private final Map<String, String> names = new TreeMap<>();
    private final Map<String, Integer> declaredSizes = new HashMap<>();
    private final Map<String, Set<String>> geneSets = new HashMap<>();
    private final Map<String, SortedSet<String>> parents = new HashMap<>();
    private final Map<String, String> aliases = new HashMap<>();
    private final List<String[]> relations = new ArrayList<>();

    HierarchySnapshotBuilder(String releaseTag) {
        this.releaseTag = Objects.requireNonNull(releaseTag, "releaseTag is required");
    }

    public HierarchySnapshotBuilder addPathway(String id, String name, Set<String> geneProductIds) {
        return addPathway(id, name, geneProductIds != null ? geneProductIds.size() : 0, geneProductIds);
    }

    /**
     * Adds a pathway whose reported size may exceed the members listed (the source only
     * lists members relevant to the loaded targets).
     */
    public HierarchySnapshotBuilder addPathway(String id, String name, int geneSetSize, Set<String> geneProductIds) {
        Objects.requireNonNull(id, "id is required");
        names.put(id, name);
        declaredSizes.put(id, geneSetSize);
        geneSets.put(id, geneProductIds != null ? Set.copyOf(geneProductIds) : Set.of());
        return this;
    }

    public HierarchySnapshotBuilder addRelation(String parentId, String childId) {
        relations.add(new String[]{parentId, childId});
        return this;
    }

    /**
     * Registers a secondary mapping from a gene symbol to a gene product of this hierarchy.
     */
    public HierarchySnapshotBuilder addGeneSymbolAlias(String geneSymbol, String geneProductId) {
        aliases.put(geneSymbol.toUpperCase(Locale.ROOT), geneProductId);
        return this;
    }

    public HierarchySnapshot build() {
        List<DataIntegrityIssue> issues = new ArrayList<>();
        Map<String, SortedSet<String>> children = new HashMap<>();
        linkRelations(children, issues);

        Map<String, Integer> depths = new HashMap<>();
        Map<String, String> treeParent = new HashMap<>();
        walkFromRoots(children, depths, treeParent);

        for (String id : names.keySet()) {
            if (!depths.containsKey(id)) {
                issues.add(new DataIntegrityIssue(id, "unreachable from any root pathway (cycle in raw hierarchy)"));
            }
        }

        Map<String, Set<String>> treeChildren = new HashMap<>();
        for (Map.Entry<String, String> edge : treeParent.entrySet()) {
            treeChildren.computeIfAbsent(edge.getValue(), k -> new TreeSet<>()).add(edge.getKey());
        }

        Map<String, PathwayNode> nodes = new HashMap<>();
        Map<String, Set<String>> keptGeneSets = new HashMap<>();
        Map<String, SortedSet<String>> byGeneProduct = new HashMap<>();
        for (Map.Entry<String, Integer> entry : depths.entrySet()) {
            String id = entry.getKey();
            Set<String> members = geneSets.getOrDefault(id, Set.of());
            int size = geneSetSize(id, members, issues);
            nodes.put(id, new PathwayNode(id, names.get(id), entry.getValue(), size,
                    ancestors(id, treeParent), treeChildren.getOrDefault(id, Set.of())));
            keptGeneSets.put(id, members);
            for (String geneProduct : members) {
                byGeneProduct.computeIfAbsent(geneProduct, k -> new TreeSet<>()).add(id);
            }
        }

        for (DataIntegrityIssue issue : issues) {
            log.warn("hierarchy.integrity release={} {}", releaseTag, issue.describe());
        }
        log.info("hierarchy.built release={} pathways={} skipped={}", releaseTag, nodes.size(), issues.size());
        return new HierarchySnapshot(releaseTag, nodes, keptGeneSets, byGeneProduct, aliases, issues);
    }

    // size 0 is kept so that scoring skips the pathway
    private int geneSetSize(String id, Set<String> members, List<DataIntegrityIssue> issues) {
        int declared = declaredSizes.getOrDefault(id, members.size());
        if (declared > 0 && declared < members.size()) {
            issues.add(new DataIntegrityIssue(id, "declared size " + declared + " is smaller than its "
                    + members.size() + " listed members"));
            return members.size();
        }
        return Math.max(declared, 0);
    }

    private void linkRelations(Map<String, SortedSet<String>> children, List<DataIntegrityIssue> issues) {
        for (String[] relation : relations) {
            String parent = relation[0];
            String child = relation[1];
            if (!names.containsKey(parent) || !names.containsKey(child)) {
                String missing = !names.containsKey(parent) ? parent : child;
                issues.add(new DataIntegrityIssue(String.valueOf(missing),
                        "relation " + parent + " -> " + child + " references an unknown pathway"));
                continue;
            }
            if (parent.equals(child)) {
                issues.add(new DataIntegrityIssue(child, "pathway lists itself as parent"));
                continue;
            }
            parents.computeIfAbsent(child, k -> new TreeSet<>()).add(parent);
            children.computeIfAbsent(parent, k -> new TreeSet<>()).add(child);
        }
    }

    /**
     * Level-by-level BFS; each level is visited in ascending id order so the first parent
     * to discover a child is the smallest id at the shortest distance.
     */
    private void walkFromRoots(Map<String, SortedSet<String>> children,
                               Map<String, Integer> depths, Map<String, String> treeParent) {
        SortedSet<String> level = new TreeSet<>();
        for (String id : names.keySet()) {
            if (!parents.containsKey(id)) {
                level.add(id);
                depths.put(id, 1);
            }
        }
        int depth = 1;
        while (!level.isEmpty()) {
            SortedSet<String> next = new TreeSet<>();
            for (String id : level) {
                for (String child : children.getOrDefault(id, new TreeSet<>())) {
                    if (!depths.containsKey(child)) {
                        depths.put(child, depth + 1);
                        treeParent.put(child, id);
                        next.add(child);
                    }
                }
            }
            level = next;
            depth++;
        }
    }

    private static Set<String> ancestors(String id, Map<String, String> treeParent) {
        Set<String> result = new LinkedHashSet<>();
        String current = treeParent.get(id);
        while (current != null) {
            result.add(current);
            current = treeParent.get(current);
        }
        return result;
    }
}

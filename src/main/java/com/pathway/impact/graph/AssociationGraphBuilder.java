package com.pathway.impact.graph;

import com.pathway.impact.core.model.CompoundIdentity;
import com.pathway.impact.core.model.PathwayScore;
import com.pathway.impact.core.model.TargetSummary;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles the association graph from a resolved compound, its displayed targets and
 * its displayed pathways. Pure function: ids derive from entity ids only, and nodes and
 * edges come out in input order (drug, targets, pathways).
 */
public class AssociationGraphBuilder {

    private static final int EDGE_HASH_HEX_CHARS = 16;

    public AssociationGraph build(CompoundIdentity compound, List<TargetSummary> targets, List<PathwayScore> pathways) {
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();

        String drugId = NodeKind.DRUG.nodeId(compound.canonicalId());
        Map<String, String> drugMetadata = new LinkedHashMap<>();
        drugMetadata.put("canonical_id", compound.canonicalId());
        if (compound.structureKey() != null) {
            drugMetadata.put("structure_key", compound.structureKey());
        }
        nodes.add(new GraphNode(drugId, compound.displayName(), NodeKind.DRUG, drugMetadata));

        Set<String> targetNodeIds = new HashSet<>();
        for (TargetSummary target : targets) {
            String targetId = NodeKind.TARGET.nodeId(target.targetId());
            if (!targetNodeIds.add(targetId)) {
                continue;
            }
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("median_potency", Double.toString(target.medianPotency()));
            metadata.put("confidence_tier", target.confidenceTier().wireName());
            metadata.put("mapping_status", target.mappingStatus().wireName());
            if (target.geneProductId() != null) {
                metadata.put("gene_product_id", target.geneProductId());
            }
            nodes.add(new GraphNode(targetId, target.targetName(), NodeKind.TARGET, metadata));
            edges.add(edge(drugId, targetId, EdgeKind.DRUG_TARGET, target.medianPotency()));
        }

        for (PathwayScore pathway : pathways) {
            String pathwayId = NodeKind.PATHWAY.nodeId(pathway.pathwayId());
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("score", Double.toString(pathway.score()));
            metadata.put("coverage_ratio", Double.toString(pathway.coverageRatio()));
            metadata.put("depth", Integer.toString(pathway.depth()));
            nodes.add(new GraphNode(pathwayId, pathway.pathwayName(), NodeKind.PATHWAY, metadata));
            for (String hitTargetId : pathway.targetIds()) {
                String targetId = NodeKind.TARGET.nodeId(hitTargetId);
                if (targetNodeIds.contains(targetId)) {
                    edges.add(edge(targetId, pathwayId, EdgeKind.TARGET_PATHWAY, pathway.score()));
                }
            }
        }
        return new AssociationGraph(nodes, edges);
    }

    static GraphEdge edge(String source, String target, EdgeKind kind, double weight) {
        return new GraphEdge(edgeId(source, target, kind), source, target, kind, weight);
    }

    /**
     * {@code edge:} followed by the first 16 hex chars of SHA-256 over {@code source|target|kind}.
     */
    static String edgeId(String source, String target, EdgeKind kind) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((source + "|" + target + "|" + kind.wireName())
                    .getBytes(StandardCharsets.UTF_8));
            return "edge:" + HexFormat.of().formatHex(hash).substring(0, EDGE_HASH_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}

package com.pathway.impact.graph;

import com.pathway.impact.core.model.CompoundIdentity;
import com.pathway.impact.core.model.PathwayScore;
import com.pathway.impact.core.model.TargetSummary;
import com.pathway.impact.fixtures.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AssociationGraphBuilder Tests")
class AssociationGraphBuilderTest {

    private final AssociationGraphBuilder builder = new AssociationGraphBuilder();
    private final CompoundIdentity erlotinib = CompoundIdentity.of(Fixtures.ERLOTINIB, "ERLOTINIB",
            "AAKJLRGGTJKAMG-UHFFFAOYSA-N", List.of("Tarceva"));
    private final TargetSummary egfr = Fixtures.target(Fixtures.EGFR, "P00533", 9.1, 4);
    private final TargetSummary erbb2 = Fixtures.target(Fixtures.ERBB2, "P04626", 6.75, 2);
    private final PathwayScore egfrPathway = new PathwayScore(Fixtures.EGFR_PATHWAY, "Signaling by EGFR", 3, 100, 1,
            9.1, 0.091, 0.01, List.of(Fixtures.EGFR), List.of(Fixtures.ROOT, Fixtures.RTK), List.of());

    @Test
    @DisplayName("Nodes come out as drug, targets, pathways with kind-prefixed ids")
    void nodeOrderAndIds() {
        AssociationGraph graph = builder.build(erlotinib, List.of(egfr, erbb2), List.of(egfrPathway));

        assertEquals(List.of("drug:CHEMBL553", "target:CHEMBL203", "target:CHEMBL1824", "pathway:R-HSA-177929"),
                graph.nodes().stream().map(GraphNode::id).toList());
        assertEquals("ERLOTINIB", graph.nodes().get(0).label());
        assertEquals("AAKJLRGGTJKAMG-UHFFFAOYSA-N", graph.nodes().get(0).metadata().get("structure_key"));
        assertEquals("high", graph.nodes().get(1).metadata().get("confidence_tier"));
        assertEquals("0.091", graph.nodes().get(3).metadata().get("score"));
    }

    @Test
    @DisplayName("Edges link drug to targets and hit targets to pathways")
    void edges() {
        AssociationGraph graph = builder.build(erlotinib, List.of(egfr, erbb2), List.of(egfrPathway));

        assertEquals(3, graph.edges().size());
        GraphEdge drugTarget = graph.edges().get(0);
        assertEquals(EdgeKind.DRUG_TARGET, drugTarget.kind());
        assertEquals("drug:CHEMBL553", drugTarget.source());
        assertEquals("target:CHEMBL203", drugTarget.target());
        assertEquals(9.1, drugTarget.weight());
        GraphEdge targetPathway = graph.edges().get(2);
        assertEquals(EdgeKind.TARGET_PATHWAY, targetPathway.kind());
        assertEquals("pathway:R-HSA-177929", targetPathway.target());
        assertEquals(0.091, targetPathway.weight());
    }

    @Test
    @DisplayName("Edge ids are stable content hashes")
    void stableEdgeIds() {
        String id = AssociationGraphBuilder.edgeId("drug:C1", "target:T1", EdgeKind.DRUG_TARGET);

        assertTrue(id.matches("edge:[0-9a-f]{16}"));
        assertEquals(id, AssociationGraphBuilder.edgeId("drug:C1", "target:T1", EdgeKind.DRUG_TARGET));
        assertNotEquals(id, AssociationGraphBuilder.edgeId("drug:C1", "target:T1", EdgeKind.TARGET_PATHWAY));
        assertEquals(builder.build(erlotinib, List.of(egfr), List.of(egfrPathway)),
                builder.build(erlotinib, List.of(egfr), List.of(egfrPathway)));
    }

    @Test
    @DisplayName("Pathway hits on targets not shown get no edge")
    void hiddenTargetHasNoEdge() {
        AssociationGraph graph = builder.build(erlotinib, List.of(erbb2), List.of(egfrPathway));

        assertEquals(1, graph.edges().size());
        assertEquals(3, graph.nodes().size());
    }

    @Test
    @DisplayName("Edges must reference existing nodes")
    void danglingEdgeRejected() {
        GraphNode drug = new GraphNode("drug:C1", "C1", NodeKind.DRUG, null);
        GraphEdge edge = AssociationGraphBuilder.edge("drug:C1", "target:T1", EdgeKind.DRUG_TARGET, 7.0);

        assertThrows(IllegalArgumentException.class, () -> new AssociationGraph(List.of(drug), List.of(edge)));
    }
}

package com.pathway.impact.fixtures;

import com.pathway.impact.api.AnalysisParams;
import com.pathway.impact.api.AnalysisResult;
import com.pathway.impact.core.model.ActivityRecord;
import com.pathway.impact.core.model.AnalysisFlags;
import com.pathway.impact.core.model.CompoundIdentity;
import com.pathway.impact.core.model.ConfidenceTier;
import com.pathway.impact.core.model.MappingStatus;
import com.pathway.impact.core.model.PathwayScore;
import com.pathway.impact.core.model.ResolutionOutcome;
import com.pathway.impact.core.model.TargetAnnotation;
import com.pathway.impact.core.model.TargetSummary;
import com.pathway.impact.hierarchy.HierarchySnapshot;
import com.pathway.impact.identity.CompoundRecord;
import com.pathway.impact.snapshot.VersionSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * A small, hand-checked slice of the kinase world: three compounds, four targets and a
 * Reactome-like hierarchy where every scored pathway sits at depth 3.
 *
 * <pre>
 * R-HSA-162582  Signal Transduction                   depth 1
 * └─ R-HSA-9006934  Signaling by RTKs                 depth 2
 *    ├─ R-HSA-177929   Signaling by EGFR  (size 100)  depth 3  {P00533}
 *    ├─ R-HSA-1227986  Signaling by ERBB2 (size 50)   depth 3  {P04626}
 *    └─ R-HSA-165159   MTOR signalling    (size 40)   depth 3  {P42345}
 * </pre>
 */
public final class Fixtures {

    public static final String RELEASE = "88";

    public static final String ROOT = "R-HSA-162582";
    public static final String RTK = "R-HSA-9006934";
    public static final String EGFR_PATHWAY = "R-HSA-177929";
    public static final String ERBB2_PATHWAY = "R-HSA-1227986";
    public static final String MTOR_PATHWAY = "R-HSA-165159";

    public static final String EGFR = "CHEMBL203";
    public static final String ERBB2 = "CHEMBL1824";
    public static final String MTOR = "CHEMBL2842";
    public static final String SRC = "CHEMBL267";

    public static final String ERLOTINIB = "CHEMBL553";
    public static final String GEFITINIB = "CHEMBL939";
    public static final String IMATINIB = "CHEMBL941";
    public static final String IMATINIB_MESYLATE = "CHEMBL1642";

    private Fixtures() {
    }

    public static HierarchySnapshot hierarchy() {
        return HierarchySnapshot.builder(RELEASE)
                .addPathway(ROOT, "Signal Transduction", 2500, Set.of("P00533", "P04626", "P42345", "P12931"))
                .addPathway(RTK, "Signaling by Receptor Tyrosine Kinases", 500, Set.of("P00533", "P04626", "P42345"))
                .addPathway(EGFR_PATHWAY, "Signaling by EGFR", 100, Set.of("P00533"))
                .addPathway(ERBB2_PATHWAY, "Signaling by ERBB2", 50, Set.of("P04626"))
                .addPathway(MTOR_PATHWAY, "MTOR signalling", 40, Set.of("P42345"))
                .addRelation(ROOT, RTK)
                .addRelation(RTK, EGFR_PATHWAY)
                .addRelation(RTK, ERBB2_PATHWAY)
                .addRelation(RTK, MTOR_PATHWAY)
                .addGeneSymbolAlias("ERBB2", "P04626")
                .build();
    }

    public static FakeIdentityProvider identityProvider() {
        return new FakeIdentityProvider()
                .add(CompoundRecord.of(ERLOTINIB, "ERLOTINIB", "AAKJLRGGTJKAMG-UHFFFAOYSA-N", "Tarceva"))
                .add(CompoundRecord.of(GEFITINIB, "GEFITINIB", "XGALLCVXEZPNRQ-UHFFFAOYSA-N", "Iressa"))
                .add(CompoundRecord.of(IMATINIB, "IMATINIB", "KTUFNOKKBVMGRW-UHFFFAOYSA-N", "Gleevec"))
                .add(CompoundRecord.of(IMATINIB_MESYLATE, "IMATINIB MESYLATE", "YLMAHDNUQAMNNX-UHFFFAOYSA-N",
                        "Gleevec"));
    }

    /**
     * Erlotinib: EGFR (4 assays, median 9.1), ERBB2 (2 assays, median 6.75, mapped through its
     * gene symbol), SRC (1 assay, low confidence) and two records the aggregator must drop.
     * Gefitinib: EGFR (2 assays, median 8.1) and MTOR (2 assays, median 6.0).
     */
    public static FakeActivityProvider activityProvider() {
        return new FakeActivityProvider()
                .activities(ERLOTINIB, List.of(
                        ActivityRecord.exact(EGFR, 9.0, "CHEMBL-A1"),
                        ActivityRecord.exact(EGFR, 9.2, "CHEMBL-A2"),
                        ActivityRecord.exact(EGFR, 9.1, "CHEMBL-A3"),
                        ActivityRecord.exact(EGFR, 9.1, "CHEMBL-A4"),
                        ActivityRecord.exact(ERBB2, 6.5, "CHEMBL-A5"),
                        ActivityRecord.exact(ERBB2, 7.0, "CHEMBL-A6"),
                        ActivityRecord.exact(SRC, 5.5, "CHEMBL-A7"),
                        new ActivityRecord(SRC, 4.0, "CHEMBL-A8", ">", true),
                        new ActivityRecord(ERBB2, 8.0, "CHEMBL-A9", "=", false)))
                .activities(GEFITINIB, List.of(
                        ActivityRecord.exact(EGFR, 8.0, "CHEMBL-B1"),
                        ActivityRecord.exact(EGFR, 8.2, "CHEMBL-B2"),
                        ActivityRecord.exact(MTOR, 6.0, "CHEMBL-B3"),
                        ActivityRecord.exact(MTOR, 6.0, "CHEMBL-B4")))
                .annotate(new TargetAnnotation(EGFR, "Epidermal growth factor receptor erbB1", "EGFR", "P00533", 9))
                .annotate(new TargetAnnotation(ERBB2, "Receptor protein-tyrosine kinase erbB-2", "ERBB2", null, 8))
                .annotate(new TargetAnnotation(MTOR, "Serine/threonine-protein kinase mTOR", "MTOR", "P42345", 9))
                .annotate(new TargetAnnotation(SRC, "Tyrosine-protein kinase SRC", "SRC", "P12931", 9));
    }

    /**
     * A mapped target summary with the given potency, for scorer and graph tests.
     */
    public static TargetSummary target(String targetId, String geneProductId, double medianPotency, int assayCount) {
        return new TargetSummary(targetId, targetId + " name", null, geneProductId, medianPotency, assayCount,
                medianPotency, medianPotency, 0.0, 9, ConfidenceTier.HIGH, List.of("tier:high"), false,
                MappingStatus.MAPPED, List.of("primary_gene_product"), List.of());
    }

    public static PathwayScore pathway(String pathwayId, String name, int size, List<String> targetIds,
                                       double medianPotency, double score) {
        return new PathwayScore(pathwayId, name, 3, size, targetIds.size(), medianPotency, score,
                (double) targetIds.size() / size, targetIds, List.of(ROOT, RTK), List.of());
    }

    /**
     * A finished analysis built by hand, for tests below the pipeline.
     */
    public static AnalysisResult result(String analysisId, String compoundId, List<TargetSummary> targets,
                                        List<PathwayScore> pathways, AnalysisParams params) {
        CompoundIdentity identity = CompoundIdentity.of(compoundId, compoundId, null, List.of());
        return AnalysisResult.builder()
                .analysisId(analysisId)
                .createdAt(Instant.parse("2026-03-01T12:00:00Z"))
                .query(compoundId)
                .params(params)
                .resolution(ResolutionOutcome.resolved(compoundId, compoundId, identity, List.of()))
                .targets(targets)
                .pathways(pathways)
                .versionSnapshot(VersionSnapshot.builder().record("chembl", "34").record("reactome", RELEASE).build())
                .analysisFlags(AnalysisFlags.unknown())
                .build();
    }
}

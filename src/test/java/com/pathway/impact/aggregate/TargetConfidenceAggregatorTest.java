package com.pathway.impact.aggregate;

import com.pathway.impact.api.AnalysisParams;
import com.pathway.impact.core.model.ActivityRecord;
import com.pathway.impact.core.model.ConfidenceTier;
import com.pathway.impact.core.model.MappingStatus;
import com.pathway.impact.core.model.TargetAnnotation;
import com.pathway.impact.core.model.TargetSummary;
import com.pathway.impact.fixtures.FakeActivityProvider;
import com.pathway.impact.fixtures.Fixtures;
import com.pathway.impact.hierarchy.HierarchySnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TargetConfidenceAggregator Tests")
class TargetConfidenceAggregatorTest {

    private final TargetConfidenceAggregator aggregator = new TargetConfidenceAggregator();
    private HierarchySnapshot snapshot;
    private List<ActivityRecord> records;
    private Map<String, TargetAnnotation> annotations;

    @BeforeEach
    void setUp() {
        snapshot = Fixtures.hierarchy();
        FakeActivityProvider provider = Fixtures.activityProvider();
        records = provider.fetchActivities(Fixtures.ERLOTINIB);
        annotations = provider.fetchTargetAnnotations(List.of(Fixtures.EGFR, Fixtures.ERBB2, Fixtures.SRC));
    }

    private AggregationResult aggregate(AnalysisParams params) {
        return aggregator.aggregate(Fixtures.ERLOTINIB, records, annotations, snapshot::mapTarget, params);
    }

    private static TargetSummary find(List<TargetSummary> targets, String targetId) {
        return targets.stream().filter(t -> t.targetId().equals(targetId)).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("Filtering and statistics")
    class Statistics {

        @Test
        @DisplayName("Only exact, valid records with a potency are counted")
        void onlyExactValidRecords() {
            AggregationResult result = aggregate(AnalysisParams.defaults());

            assertEquals(7, result.acceptedRecords());
            assertEquals(3, result.summaries().size());
            assertEquals(1, find(result.summaries(), Fixtures.SRC).assayCount());
            assertEquals(2, find(result.summaries(), Fixtures.ERBB2).assayCount());
        }

        @Test
        @DisplayName("Summary carries median, range, IQR and sorted assay ids")
        void summaryStatistics() {
            TargetSummary egfr = find(aggregate(AnalysisParams.defaults()).summaries(), Fixtures.EGFR);

            assertEquals(9.1, egfr.medianPotency());
            assertEquals(4, egfr.assayCount());
            assertEquals(9.0, egfr.potencyMin());
            assertEquals(9.2, egfr.potencyMax());
            assertEquals(0.05, egfr.potencyIqr());
            assertEquals(List.of("CHEMBL-A1", "CHEMBL-A2", "CHEMBL-A3", "CHEMBL-A4"), egfr.sourceAssayIds());
            assertEquals("Epidermal growth factor receptor erbB1", egfr.targetName());
        }

        @Test
        @DisplayName("Summaries are ordered by potency desc, then target id")
        void potencyOrder() {
            List<TargetSummary> summaries = aggregate(AnalysisParams.defaults()).summaries();

            assertEquals(List.of(Fixtures.EGFR, Fixtures.ERBB2, Fixtures.SRC),
                    summaries.stream().map(TargetSummary::targetId).toList());
        }

        @Test
        @DisplayName("Source assay ids are de-duplicated and capped")
        void assayIdsCapped() {
            List<ActivityRecord> many = new ArrayList<>();
            for (int i = 0; i < 60; i++) {
                many.add(ActivityRecord.exact("T1", 7.0, String.format("A%03d", i)));
                many.add(ActivityRecord.exact("T1", 7.0, String.format("A%03d", i)));
            }
            AggregationResult result = aggregator.aggregate("C1", many, Map.of(), snapshot::mapTarget,
                    AnalysisParams.defaults());

            TargetSummary summary = result.summaries().get(0);
            assertEquals(120, summary.assayCount());
            assertEquals(TargetConfidenceAggregator.MAX_SOURCE_ASSAY_IDS, summary.sourceAssayIds().size());
            assertEquals("A000", summary.sourceAssayIds().get(0));
        }
    }

    @Nested
    @DisplayName("Confidence")
    class Confidence {

        @Test
        @DisplayName("Well-replicated potent target with high prior is high tier")
        void highTier() {
            TargetSummary egfr = find(aggregate(AnalysisParams.defaults()).summaries(), Fixtures.EGFR);

            assertEquals(ConfidenceTier.HIGH, egfr.confidenceTier());
            assertFalse(egfr.lowConfidence());
            assertEquals(9, egfr.priorConfidence());
        }

        @Test
        @DisplayName("Target below min_assays is kept, marked low-confidence and hidden by default")
        void belowMinAssaysHidden() {
            AggregationResult result = aggregate(AnalysisParams.defaults());
            TargetSummary src = find(result.summaries(), Fixtures.SRC);

            assertTrue(src.lowConfidence());
            assertTrue(src.confidenceReasons().contains("assay_count<min_assays(2)"));
            assertEquals(List.of(Fixtures.SRC), result.excludedLowConfidenceTargetIds());
            assertTrue(result.visible().stream().noneMatch(t -> t.targetId().equals(Fixtures.SRC)));
        }

        @Test
        @DisplayName("include_low_confidence shows low-confidence targets")
        void includeLowConfidence() {
            AggregationResult result = aggregate(AnalysisParams.builder().includeLowConfidence(true).build());

            assertEquals(3, result.visible().size());
            assertTrue(result.excludedLowConfidenceTargetIds().isEmpty());
            assertTrue(find(result.visible(), Fixtures.SRC).lowConfidence());
        }

        @Test
        @DisplayName("Raising min_assays demotes targets without changing their tier")
        void minAssaysIndependentOfTier() {
            AggregationResult result = aggregate(AnalysisParams.builder().minAssays(3).build());
            TargetSummary erbb2 = find(result.summaries(), Fixtures.ERBB2);

            assertEquals(ConfidenceTier.MEDIUM, erbb2.confidenceTier());
            assertTrue(erbb2.lowConfidence());
            assertEquals(List.of(Fixtures.ERBB2, Fixtures.SRC), result.excludedLowConfidenceTargetIds());
        }

        @Test
        @DisplayName("Unknown prior confidence falls back to the default and says so")
        void unknownPrior() {
            AggregationResult result = aggregator.aggregate(Fixtures.ERLOTINIB, records, Map.of(),
                    snapshot::mapTarget, AnalysisParams.defaults());
            TargetSummary egfr = find(result.summaries(), Fixtures.EGFR);

            assertEquals(TargetConfidenceAggregator.DEFAULT_PRIOR_CONFIDENCE, egfr.priorConfidence());
            assertTrue(egfr.confidenceReasons().contains("target_confidence_unknown"));
            assertEquals(ConfidenceTier.MEDIUM, egfr.confidenceTier());
            assertEquals(Fixtures.EGFR, egfr.targetName());
        }
    }

    @Nested
    @DisplayName("Mapping and truncation")
    class Mapping {

        @Test
        @DisplayName("Primary gene product maps directly, gene symbol alias maps partially")
        void mappingStatus() {
            List<TargetSummary> summaries = aggregate(AnalysisParams.defaults()).summaries();
            TargetSummary egfr = find(summaries, Fixtures.EGFR);
            TargetSummary erbb2 = find(summaries, Fixtures.ERBB2);

            assertEquals(MappingStatus.MAPPED, egfr.mappingStatus());
            assertEquals("P00533", egfr.geneProductId());
            assertEquals(MappingStatus.PARTIAL, erbb2.mappingStatus());
            assertEquals("P04626", erbb2.geneProductId());
            assertTrue(erbb2.mappingNotes().contains("secondary mapping"));
        }

        @Test
        @DisplayName("Visible targets are capped at max_targets with a degraded message")
        void maxTargets() {
            AggregationResult result = aggregate(AnalysisParams.builder()
                    .includeLowConfidence(true)
                    .maxTargets(2)
                    .build());

            assertEquals(2, result.visible().size());
            assertEquals(3, result.summaries().size());
            assertEquals(List.of("Showing top 2 targets by potency for performance."), result.degradedMessages());
            assertEquals(Fixtures.EGFR, result.visible().get(0).targetId());
        }

        @Test
        @DisplayName("No records yields an empty result")
        void noRecords() {
            AggregationResult result = aggregator.aggregate("C1", List.of(), Map.of(), snapshot::mapTarget,
                    AnalysisParams.defaults());

            assertTrue(result.visible().isEmpty());
            assertEquals(0, result.totalVisibleAssays());
        }
    }
}

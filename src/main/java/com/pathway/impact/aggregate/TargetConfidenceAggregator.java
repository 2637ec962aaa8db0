package com.pathway.impact.aggregate;

import com.pathway.impact.api.AnalysisParams;
import com.pathway.impact.core.model.ActivityRecord;
import com.pathway.impact.core.model.ConfidenceTier;
import com.pathway.impact.core.model.MappingStatus;
import com.pathway.impact.core.model.TargetAnnotation;
import com.pathway.impact.core.model.TargetSummary;
import com.pathway.impact.hierarchy.GeneProductMapping;
import com.pathway.impact.rules.ConfidenceAssessment;
import com.pathway.impact.rules.ConfidenceInputs;
import com.pathway.impact.rules.ConfidenceRuleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Reduces raw activity records into one {@link TargetSummary} per target.
 *
 * <p>Only exact ({@code "="}), valid records with a potency count. Targets below
 * {@code minAssays} are kept but marked low-confidence, as are {@code low}-tier targets;
 * whether they are shown is up to {@code includeLowConfidence}.</p>
 */
public class TargetConfidenceAggregator {
    private static final Logger log = LoggerFactory.getLogger(TargetConfidenceAggregator.class);

    /** Prior confidence assumed for targets the activity source gives no score for. */
    public static final int DEFAULT_PRIOR_CONFIDENCE = 8;
    public static final int MAX_SOURCE_ASSAY_IDS = 50;

    public static final Comparator<TargetSummary> POTENCY_ORDER =
            Comparator.comparingDouble(TargetSummary::medianPotency).reversed()
                    .thenComparing(TargetSummary::targetId);

    public AggregationResult aggregate(String compoundId,
                                       List<ActivityRecord> records,
                                       Map<String, TargetAnnotation> annotations,
                                       Function<TargetAnnotation, GeneProductMapping> geneProductMapper,
                                       AnalysisParams params) {
        ConfidenceRuleEngine rules = ConfidenceRuleEngine.standard(params.potencyThreshold());

        Map<String, List<ActivityRecord>> byTarget = new TreeMap<>();
        int accepted = 0;
        for (ActivityRecord record : records) {
            if (isAccepted(record)) {
                byTarget.computeIfAbsent(record.targetId(), k -> new ArrayList<>()).add(record);
                accepted++;
            }
        }

        List<TargetSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, List<ActivityRecord>> entry : byTarget.entrySet()) {
            TargetAnnotation annotation = annotations.getOrDefault(entry.getKey(),
                    TargetAnnotation.unknown(entry.getKey()));
            summaries.add(summarize(entry.getKey(), entry.getValue(), annotation, geneProductMapper, rules, params));
        }
        summaries.sort(POTENCY_ORDER);

        List<TargetSummary> visible = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        for (TargetSummary summary : summaries) {
            if (summary.lowConfidence() && !params.includeLowConfidence()) {
                excluded.add(summary.targetId());
            } else {
                visible.add(summary);
            }
        }
        excluded.sort(Comparator.naturalOrder());

        List<String> degraded = new ArrayList<>();
        if (visible.size() > params.maxTargets()) {
            visible = new ArrayList<>(visible.subList(0, params.maxTargets()));
            degraded.add("Showing top " + params.maxTargets() + " targets by potency for performance.");
        }

        log.debug("aggregate.completed compound={} records={} accepted={} targets={} visible={} hidden={}",
                compoundId, records.size(), accepted, summaries.size(), visible.size(), excluded.size());
        return new AggregationResult(summaries, visible, excluded, degraded, accepted);
    }

    static boolean isAccepted(ActivityRecord record) {
        return ActivityRecord.EXACT_RELATION.equals(record.relation())
                && record.valid()
                && record.potency() != null
                && Double.isFinite(record.potency())
                && record.targetId() != null
                && !record.targetId().isBlank();
    }

    private TargetSummary summarize(String targetId, List<ActivityRecord> records, TargetAnnotation annotation,
                                    Function<TargetAnnotation, GeneProductMapping> geneProductMapper,
                                    ConfidenceRuleEngine rules, AnalysisParams params) {
        List<Double> values = records.stream().map(ActivityRecord::potency).toList();
        double median = PotencyStatistics.median(values);
        double iqr = PotencyStatistics.iqr(values);
        int assayCount = records.size();

        List<String> reasons = new ArrayList<>();
        int prior;
        if (annotation.priorConfidence() != null) {
            prior = annotation.priorConfidence();
        } else {
            prior = DEFAULT_PRIOR_CONFIDENCE;
            reasons.add("target_confidence_unknown");
        }

        ConfidenceAssessment assessment = rules.assess(new ConfidenceInputs(median, assayCount, prior, iqr));
        reasons.addAll(0, assessment.reasons());
        boolean belowMinAssays = assayCount < params.minAssays();
        if (belowMinAssays) {
            reasons.add("assay_count<min_assays(" + params.minAssays() + ")");
        }
        boolean lowConfidence = belowMinAssays || assessment.tier() == ConfidenceTier.LOW;

        GeneProductMapping mapping = geneProductMapper.apply(annotation);
        String geneProductId = mapping.status() == MappingStatus.UNMAPPED
                ? annotation.geneProductId()
                : mapping.geneProductId();

        List<String> assayIds = new ArrayList<>(new TreeSet<>(records.stream()
                .map(ActivityRecord::assayId)
                .filter(id -> id != null && !id.isBlank())
                .toList()));
        if (assayIds.size() > MAX_SOURCE_ASSAY_IDS) {
            assayIds = assayIds.subList(0, MAX_SOURCE_ASSAY_IDS);
        }

        return new TargetSummary(
                targetId,
                annotation.targetName(),
                annotation.geneSymbol(),
                geneProductId,
                median,
                assayCount,
                PotencyStatistics.round6(values.stream().mapToDouble(Double::doubleValue).min().orElseThrow()),
                PotencyStatistics.round6(values.stream().mapToDouble(Double::doubleValue).max().orElseThrow()),
                iqr,
                prior,
                assessment.tier(),
                reasons,
                lowConfidence,
                mapping.status(),
                mapping.notes(),
                assayIds);
    }
}

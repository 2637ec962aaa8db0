package com.pathway.impact.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Per (compound, target) potency and confidence summary.
 * The tier is a pure function of the aggregated inputs and is never overridden;
 * summaries are recomputed per run rather than patched.
 */
public record TargetSummary(
        String targetId,
        String targetName,
        String geneSymbol,
        String geneProductId,
        double medianPotency,
        int assayCount,
        double potencyMin,
        double potencyMax,
        double potencyIqr,
        int priorConfidence,
        ConfidenceTier confidenceTier,
        List<String> confidenceReasons,
        boolean lowConfidence,
        MappingStatus mappingStatus,
        List<String> mappingNotes,
        List<String> sourceAssayIds
) {
    public TargetSummary {
        Objects.requireNonNull(targetId, "targetId is required");
        Objects.requireNonNull(confidenceTier, "confidenceTier is required");
        Objects.requireNonNull(mappingStatus, "mappingStatus is required");
        if (assayCount < 1) {
            throw new IllegalArgumentException("assayCount must be >= 1");
        }
        confidenceReasons = confidenceReasons != null ? List.copyOf(confidenceReasons) : List.of();
        mappingNotes = mappingNotes != null ? List.copyOf(mappingNotes) : List.of();
        sourceAssayIds = sourceAssayIds != null ? List.copyOf(sourceAssayIds) : List.of();
    }
}

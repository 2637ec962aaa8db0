package com.pathway.impact.core.model;

import java.util.Objects;

/**
 * Descriptive details for a target, fetched alongside the activity records.
 *
 * @param targetId        target identifier
 * @param targetName      preferred name
 * @param geneSymbol      gene symbol, or null
 * @param geneProductId   primary gene product accession (UniProt-equivalent), or null
 * @param priorConfidence target-level prior confidence score (0-9), or null when unknown
 */
public record TargetAnnotation(
        String targetId,
        String targetName,
        String geneSymbol,
        String geneProductId,
        Integer priorConfidence
) {
    public TargetAnnotation {
        Objects.requireNonNull(targetId, "targetId is required");
        targetName = targetName != null && !targetName.isBlank() ? targetName : targetId;
    }

    /**
     * Placeholder annotation used when target details could not be fetched.
     */
    public static TargetAnnotation unknown(String targetId) {
        return new TargetAnnotation(targetId, targetId, null, null, null);
    }
}

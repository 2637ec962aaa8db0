package com.pathway.impact.core.model;

import java.util.Objects;

/**
 * Quality signals attached to an analysis.
 *
 * @param limitedData     too few targets or assays to draw conclusions
 * @param partialMapping  some targets could not be (fully) placed in the pathway hierarchy
 * @param highVariability some well-sampled target shows a wide potency spread
 */
public record AnalysisFlags(TriState limitedData, TriState partialMapping, TriState highVariability) {

    public AnalysisFlags {
        Objects.requireNonNull(limitedData, "limitedData is required");
        Objects.requireNonNull(partialMapping, "partialMapping is required");
        Objects.requireNonNull(highVariability, "highVariability is required");
    }

    public static AnalysisFlags unknown() {
        return new AnalysisFlags(TriState.UNKNOWN, TriState.UNKNOWN, TriState.UNKNOWN);
    }
}

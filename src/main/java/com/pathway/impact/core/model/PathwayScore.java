package com.pathway.impact.core.model;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Impact of a compound on one pathway:
 * {@code score = (targetsHit / pathwaySize) * medianPotency}.
 *
 * @param ancestorPathwayIds every ancestor of the pathway, kept for traceability
 * @param absorbedPathwayIds ancestors removed from the displayed set because they were
 *                           hit by exactly the same targets as this pathway
 */
public record PathwayScore(
        String pathwayId,
        String pathwayName,
        int depth,
        int pathwaySize,
        int targetsHit,
        double medianPotency,
        double score,
        double coverageRatio,
        List<String> targetIds,
        List<String> ancestorPathwayIds,
        List<String> absorbedPathwayIds
) {
    /**
     * Display order: score desc, coverage desc, pathway id asc.
     */
    public static final Comparator<PathwayScore> DISPLAY_ORDER =
            Comparator.comparingDouble(PathwayScore::score).reversed()
                    .thenComparing(Comparator.comparingDouble(PathwayScore::coverageRatio).reversed())
                    .thenComparing(PathwayScore::pathwayId);

    public PathwayScore {
        Objects.requireNonNull(pathwayId, "pathwayId is required");
        if (score < 0.0) {
            throw new IllegalArgumentException("score must be non-negative");
        }
        targetIds = targetIds != null ? List.copyOf(targetIds) : List.of();
        ancestorPathwayIds = ancestorPathwayIds != null ? List.copyOf(ancestorPathwayIds) : List.of();
        absorbedPathwayIds = absorbedPathwayIds != null ? List.copyOf(absorbedPathwayIds) : List.of();
    }
}

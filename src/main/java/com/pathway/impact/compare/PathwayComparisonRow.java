package com.pathway.impact.compare;

import java.util.Comparator;

/**
 * One pathway of the union of both analyses' displayed pathways.
 *
 * @param scoreA null when the pathway is not among A's displayed pathways
 * @param scoreB null when the pathway is not among B's displayed pathways
 * @param delta  {@code scoreA - scoreB}, null unless both scores are present
 */
public record PathwayComparisonRow(
        String pathwayId,
        String pathwayName,
        Double scoreA,
        Double scoreB,
        Double delta,
        boolean shared
) {
    /**
     * Largest absolute delta first (a missing delta counts as 0), then pathway id.
     */
    public static final Comparator<PathwayComparisonRow> ORDER =
            Comparator.comparingDouble((PathwayComparisonRow row) -> row.delta() == null ? 0.0 : Math.abs(row.delta()))
                    .reversed()
                    .thenComparing(PathwayComparisonRow::pathwayId);
}

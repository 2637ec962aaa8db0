package com.pathway.impact.scoring;

import com.pathway.impact.core.model.PathwayScore;
import com.pathway.impact.hierarchy.DataIntegrityIssue;

import java.util.List;

/**
 * Output of {@link PathwayImpactScorer}.
 *
 * @param pathways             displayed pathways, ranked and truncated
 * @param integrityIssues      pathways skipped because of bad reference data
 * @param pathwaysHit          pathways containing at least one scored target
 * @param pathwaysInDepthBand  of those, pathways that passed the depth filter
 */
public record ScoringResult(
        List<PathwayScore> pathways,
        List<DataIntegrityIssue> integrityIssues,
        int pathwaysHit,
        int pathwaysInDepthBand
) {
    public ScoringResult {
        pathways = List.copyOf(pathways);
        integrityIssues = List.copyOf(integrityIssues);
    }

    public boolean isEmpty() {
        return pathways.isEmpty();
    }
}

package com.pathway.impact.compare;

public record CompareMetrics(
        double targetJaccard,
        double pathwayCosineSimilarity,
        int sharedPathwayCount,
        int uniquePathwayCountA,
        int uniquePathwayCountB
) {
    public CompareMetrics {
        if (targetJaccard < 0.0 || targetJaccard > 1.0) {
            throw new IllegalArgumentException("targetJaccard must be within [0, 1]");
        }
    }
}

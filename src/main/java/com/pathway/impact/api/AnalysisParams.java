package com.pathway.impact.api;

import com.pathway.impact.error.ConfigurationException;

/**
 * Tunable parameters of an analysis run. Two analyses can only be compared when
 * their parameters are equal.
 *
 * @param potencyThreshold     median potency a target needs for the medium tier (4.0-10.0)
 * @param minAssays            assays a target needs before it counts as measured (1-20)
 * @param includeLowConfidence whether low-confidence targets are shown and scored
 * @param topPathways          pathways kept after ranking (1-100)
 * @param minDepth             shallowest displayed pathway depth (&gt;= 2)
 * @param maxDepth             deepest displayed pathway depth
 * @param maxTargets           visible targets kept, strongest first (1-500)
 */
public record AnalysisParams(
        double potencyThreshold,
        int minAssays,
        boolean includeLowConfidence,
        int topPathways,
        int minDepth,
        int maxDepth,
        int maxTargets
) {
    public static final double DEFAULT_POTENCY_THRESHOLD = 5.0;
    public static final int DEFAULT_MIN_ASSAYS = 2;
    public static final int DEFAULT_TOP_PATHWAYS = 20;
    public static final int DEFAULT_MIN_DEPTH = 3;
    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final int DEFAULT_MAX_TARGETS = 50;

    public AnalysisParams {
        if (Double.isNaN(potencyThreshold) || potencyThreshold < 4.0 || potencyThreshold > 10.0) {
            throw new ConfigurationException("potencyThreshold must be between 4.0 and 10.0, got " + potencyThreshold);
        }
        if (minAssays < 1 || minAssays > 20) {
            throw new ConfigurationException("minAssays must be between 1 and 20, got " + minAssays);
        }
        if (topPathways < 1 || topPathways > 100) {
            throw new ConfigurationException("topPathways must be between 1 and 100, got " + topPathways);
        }
        // depth 1 is the umbrella level and is never displayed
        if (minDepth < 2) {
            throw new ConfigurationException("minDepth must be >= 2, got " + minDepth);
        }
        if (maxDepth < minDepth) {
            throw new ConfigurationException("maxDepth must be >= minDepth (" + minDepth + "), got " + maxDepth);
        }
        if (maxTargets < 1 || maxTargets > 500) {
            throw new ConfigurationException("maxTargets must be between 1 and 500, got " + maxTargets);
        }
    }

    public static AnalysisParams defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .potencyThreshold(potencyThreshold)
                .minAssays(minAssays)
                .includeLowConfidence(includeLowConfidence)
                .topPathways(topPathways)
                .depthBand(minDepth, maxDepth)
                .maxTargets(maxTargets);
    }

    public static class Builder {
        private double potencyThreshold = DEFAULT_POTENCY_THRESHOLD;
        private int minAssays = DEFAULT_MIN_ASSAYS;
        private boolean includeLowConfidence = false;
        private int topPathways = DEFAULT_TOP_PATHWAYS;
        private int minDepth = DEFAULT_MIN_DEPTH;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int maxTargets = DEFAULT_MAX_TARGETS;

        public Builder potencyThreshold(double potencyThreshold) {
            this.potencyThreshold = potencyThreshold;
            return this;
        }

        public Builder minAssays(int minAssays) {
            this.minAssays = minAssays;
            return this;
        }

        public Builder includeLowConfidence(boolean includeLowConfidence) {
            this.includeLowConfidence = includeLowConfidence;
            return this;
        }

        public Builder topPathways(int topPathways) {
            this.topPathways = topPathways;
            return this;
        }

        public Builder depthBand(int minDepth, int maxDepth) {
            this.minDepth = minDepth;
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder maxTargets(int maxTargets) {
            this.maxTargets = maxTargets;
            return this;
        }

        public AnalysisParams build() {
            return new AnalysisParams(potencyThreshold, minAssays, includeLowConfidence,
                    topPathways, minDepth, maxDepth, maxTargets);
        }
    }
}

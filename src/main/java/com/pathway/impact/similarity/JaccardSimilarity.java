package com.pathway.impact.similarity;

import java.util.Set;

/**
 * Jaccard similarity of two id sets: |intersection| / |union|.
 * Two empty sets have nothing in common and score 0.0.
 */
public class JaccardSimilarity {

    public double compute(Set<String> a, Set<String> b) {
        if (a == null || b == null || (a.isEmpty() && b.isEmpty())) {
            return 0.0;
        }
        int intersectionSize = 0;
        for (String id : a) {
            if (b.contains(id)) {
                intersectionSize++;
            }
        }
        // |union| = |A| + |B| - |intersection|
        int unionSize = a.size() + b.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }
}

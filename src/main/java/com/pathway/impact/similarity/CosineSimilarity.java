package com.pathway.impact.similarity;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cosine similarity of two sparse vectors indexed by id. The vectors span the union of
 * both key sets; a missing entry counts as 0. A zero vector on either side gives 0.0.
 */
public class CosineSimilarity {

    public double compute(Map<String, Double> a, Map<String, Double> b) {
        Set<String> ids = new TreeSet<>(a.keySet());
        ids.addAll(b.keySet());
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        // ascending id order keeps the floating-point sum reproducible
        for (String id : ids) {
            double x = a.getOrDefault(id, 0.0);
            double y = b.getOrDefault(id, 0.0);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}

package com.pathway.impact.rules;

/**
 * Everything a confidence tier may depend on. Nothing else is consulted, which
 * keeps the tier a pure function of these values.
 */
public record ConfidenceInputs(double medianPotency, int assayCount, int priorConfidence, double iqr) {
}

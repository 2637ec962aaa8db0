package com.pathway.impact.rules;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named predicate over {@link ConfidenceInputs}. The name is recorded verbatim in a
 * target's confidence reasons when the criterion holds, the negated name when it fails.
 */
public final class ConfidenceCriterion {

    private final String name;
    private final String negatedName;
    private final Predicate<ConfidenceInputs> predicate;

    private ConfidenceCriterion(String name, String negatedName, Predicate<ConfidenceInputs> predicate) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.negatedName = Objects.requireNonNull(negatedName, "negatedName is required");
        this.predicate = Objects.requireNonNull(predicate, "predicate is required");
    }

    public static ConfidenceCriterion assayCountAtLeast(int minimum) {
        return new ConfidenceCriterion("assay_count>=" + minimum, "assay_count<" + minimum,
                in -> in.assayCount() >= minimum);
    }

    public static ConfidenceCriterion medianPotencyAtLeast(double minimum) {
        return new ConfidenceCriterion("median_potency>=" + minimum, "median_potency<" + minimum,
                in -> in.medianPotency() >= minimum);
    }

    public static ConfidenceCriterion priorConfidenceAtLeast(int minimum) {
        return new ConfidenceCriterion("target_confidence>=" + minimum, "target_confidence<" + minimum,
                in -> in.priorConfidence() >= minimum);
    }

    public boolean test(ConfidenceInputs inputs) {
        return predicate.test(inputs);
    }

    public String name() {
        return name;
    }

    public String negatedName() {
        return negatedName;
    }

    /**
     * Returns the label describing this criterion's outcome for the inputs.
     */
    public String describe(ConfidenceInputs inputs) {
        return test(inputs) ? name : negatedName;
    }

    @Override
    public String toString() {
        return name;
    }
}

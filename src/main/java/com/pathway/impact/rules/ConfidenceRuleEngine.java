package com.pathway.impact.rules;

import com.pathway.impact.core.model.ConfidenceTier;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Evaluates confidence rules in fixed priority order; the first matching rule wins.
 *
 * <p>Reasons are recorded for every rule evaluated: the failed criteria of each rule
 * that did not match (negated form), then {@code tier:<name>} of the winning rule and the
 * criteria that made it match.</p>
 */
public class ConfidenceRuleEngine {

    public static final double HIGH_POTENCY_THRESHOLD = 6.0;
    public static final int HIGH_PRIOR_CONFIDENCE = 9;
    public static final int MIN_REPLICATE_ASSAYS = 2;

    private final List<ConfidenceRule> rules;

    public ConfidenceRuleEngine(List<ConfidenceRule> rules) {
        if (rules == null || rules.isEmpty()) {
            throw new IllegalArgumentException("At least one confidence rule is required");
        }
        if (!rules.get(rules.size() - 1).criteria().isEmpty()) {
            throw new IllegalArgumentException("The last confidence rule must be an unconditional fallback");
        }
        this.rules = List.copyOf(rules);
    }

    /**
     * Standard rule set:
     * <ol>
     *   <li>{@code high}: assay_count &gt;= 2, median potency &gt;= 6.0, prior confidence &gt;= 9</li>
     *   <li>{@code medium}: assay_count &gt;= 2, median potency &gt;= the analysis potency threshold</li>
     *   <li>{@code low}: fallback</li>
     * </ol>
     */
    public static ConfidenceRuleEngine standard(double potencyThreshold) {
        return new ConfidenceRuleEngine(List.of(
                new ConfidenceRule("high", ConfidenceTier.HIGH, List.of(
                        ConfidenceCriterion.assayCountAtLeast(MIN_REPLICATE_ASSAYS),
                        ConfidenceCriterion.medianPotencyAtLeast(HIGH_POTENCY_THRESHOLD),
                        ConfidenceCriterion.priorConfidenceAtLeast(HIGH_PRIOR_CONFIDENCE))),
                new ConfidenceRule("medium", ConfidenceTier.MEDIUM, List.of(
                        ConfidenceCriterion.assayCountAtLeast(MIN_REPLICATE_ASSAYS),
                        ConfidenceCriterion.medianPotencyAtLeast(potencyThreshold))),
                new ConfidenceRule("low", ConfidenceTier.LOW, List.of())
        ));
    }

    public ConfidenceAssessment assess(ConfidenceInputs inputs) {
        Set<String> reasons = new LinkedHashSet<>();
        for (ConfidenceRule rule : rules) {
            if (rule.matches(inputs)) {
                reasons.add("tier:" + rule.name());
                for (ConfidenceCriterion criterion : rule.criteria()) {
                    reasons.add(criterion.name());
                }
                return new ConfidenceAssessment(rule.tier(), new ArrayList<>(reasons));
            }
            for (ConfidenceCriterion criterion : rule.criteria()) {
                if (!criterion.test(inputs)) {
                    reasons.add(criterion.negatedName());
                }
            }
        }
        // unreachable: the last rule is an unconditional fallback
        throw new IllegalStateException("No confidence rule matched");
    }
}

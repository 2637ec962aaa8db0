package com.pathway.impact.rules;

import com.pathway.impact.core.model.ConfidenceTier;

import java.util.List;

/**
 * The tier picked by a {@link ConfidenceRuleEngine} and the reasons behind it, in
 * evaluation order.
 */
public record ConfidenceAssessment(ConfidenceTier tier, List<String> reasons) {

    public ConfidenceAssessment {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }
}

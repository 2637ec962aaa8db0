package com.pathway.impact.rules;

import com.pathway.impact.core.model.ConfidenceTier;

import java.util.List;
import java.util.Objects;

/**
 * Assigns a tier when every one of its criteria holds. A rule with no criteria
 * always matches and serves as the fallback.
 */
public final class ConfidenceRule {

    private final String name;
    private final ConfidenceTier tier;
    private final List<ConfidenceCriterion> criteria;

    public ConfidenceRule(String name, ConfidenceTier tier, List<ConfidenceCriterion> criteria) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.tier = Objects.requireNonNull(tier, "tier is required");
        this.criteria = criteria != null ? List.copyOf(criteria) : List.of();
    }

    public boolean matches(ConfidenceInputs inputs) {
        return criteria.stream().allMatch(c -> c.test(inputs));
    }

    public String name() {
        return name;
    }

    public ConfidenceTier tier() {
        return tier;
    }

    public List<ConfidenceCriterion> criteria() {
        return criteria;
    }

    @Override
    public String toString() {
        return "ConfidenceRule{name='" + name + "', tier=" + tier + ", criteria=" + criteria + '}';
    }
}

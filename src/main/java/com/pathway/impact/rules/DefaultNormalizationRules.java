package com.pathway.impact.rules;

import java.util.List;

/**
 * Built-in rules for compound queries. Salt and hydrate suffixes are deliberately
 * left alone: a free base and its salt are distinct canonical parents and must surface
 * as separate candidates.
 */
public final class DefaultNormalizationRules {

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getQueryRules());
        return engine;
    }

    public static List<NormalizationRule> getQueryRules() {
        return List.of(
                NormalizationRule.of("trademark-symbols", "[\\u00AE\\u2122\\u00A9]", "", 10),
                NormalizationRule.of("wrapping-quotes", "^\\s*[\"'`]+|[\"'`]+\\s*$", "", 20),
                NormalizationRule.of("unicode-dashes", "[\\u2010-\\u2015]", "-", 30),
                // "aspirin 100 mg" and "aspirin" are the same compound query
                NormalizationRule.of("dose-suffix", "\\s+\\d+(\\.\\d+)?\\s*(mg|mcg|ug|g|ml|%)$", "", 40)
        );
    }
}

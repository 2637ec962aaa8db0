package com.pathway.impact.rules;

import com.pathway.impact.core.model.ConfidenceTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfidenceRuleEngine Tests")
class ConfidenceRuleEngineTest {

    private final ConfidenceRuleEngine engine = ConfidenceRuleEngine.standard(5.0);

    @ParameterizedTest(name = "median={0} assays={1} prior={2} -> {3}")
    @DisplayName("Standard rules should assign tiers")
    @CsvSource({
            "9.1, 4, 9, HIGH",
            "6.0, 2, 9, HIGH",
            "9.1, 4, 8, MEDIUM",
            "5.9, 3, 9, MEDIUM",
            "5.0, 2, 0, MEDIUM",
            "4.9, 5, 9, LOW",
            "9.5, 1, 9, LOW"
    })
    void tiers(double median, int assays, int prior, ConfidenceTier expected) {
        assertEquals(expected, engine.assess(new ConfidenceInputs(median, assays, prior, 0.0)).tier());
    }

    @ParameterizedTest(name = "assays={0} prior={1} threshold={2}")
    @DisplayName("Tier never drops as median potency rises")
    @CsvSource({
            "1, 9, 5.0",
            "2, 9, 5.0",
            "2, 8, 5.0",
            "3, 0, 4.0",
            "5, 9, 7.5"
    })
    void monotoneInPotency(int assays, int prior, double threshold) {
        ConfidenceRuleEngine rules = ConfidenceRuleEngine.standard(threshold);
        ConfidenceTier previous = ConfidenceTier.LOW;
        for (double median = 4.0; median <= 10.0; median += 0.25) {
            ConfidenceTier tier = rules.assess(new ConfidenceInputs(median, assays, prior, 0.5)).tier();
            assertTrue(tier.compareTo(previous) >= 0, "tier dropped to " + tier + " at median " + median);
            previous = tier;
        }
    }

    @ParameterizedTest(name = "median={0} prior={1} threshold={2}")
    @DisplayName("Tier never drops as assay count rises")
    @CsvSource({
            "4.5, 9, 5.0",
            "5.5, 9, 5.0",
            "6.5, 8, 5.0",
            "9.0, 9, 5.0",
            "7.0, 9, 7.5"
    })
    void monotoneInAssayCount(double median, int prior, double threshold) {
        ConfidenceRuleEngine rules = ConfidenceRuleEngine.standard(threshold);
        ConfidenceTier previous = ConfidenceTier.LOW;
        for (int assays = 1; assays <= 12; assays++) {
            ConfidenceTier tier = rules.assess(new ConfidenceInputs(median, assays, prior, 0.5)).tier();
            assertTrue(tier.compareTo(previous) >= 0, "tier dropped to " + tier + " at " + assays + " assays");
            previous = tier;
        }
    }

    @Test
    @DisplayName("Reasons should name failed criteria before the matched rule")
    void reasonsExplainTier() {
        ConfidenceAssessment assessment = engine.assess(new ConfidenceInputs(6.75, 2, 8, 0.25));

        assertEquals(ConfidenceTier.MEDIUM, assessment.tier());
        assertEquals(List.of("target_confidence<9", "tier:medium", "assay_count>=2", "median_potency>=5.0"),
                assessment.reasons());
    }

    @Test
    @DisplayName("Low tier should list each failed criterion once")
    void lowTierReasons() {
        ConfidenceAssessment assessment = engine.assess(new ConfidenceInputs(5.5, 1, 9, 0.0));

        assertEquals(ConfidenceTier.LOW, assessment.tier());
        assertEquals(List.of("assay_count<2", "median_potency<6.0", "tier:low"), assessment.reasons());
    }

    @Test
    @DisplayName("Potency threshold should move the medium cut-off")
    void thresholdIsConfigurable() {
        ConfidenceInputs inputs = new ConfidenceInputs(5.5, 3, 8, 0.0);

        assertEquals(ConfidenceTier.MEDIUM, ConfidenceRuleEngine.standard(5.0).assess(inputs).tier());
        assertEquals(ConfidenceTier.LOW, ConfidenceRuleEngine.standard(6.0).assess(inputs).tier());
    }

    @Test
    @DisplayName("Same inputs should always give the same assessment")
    void deterministic() {
        ConfidenceInputs inputs = new ConfidenceInputs(7.2, 3, 9, 0.4);
        assertEquals(engine.assess(inputs), engine.assess(inputs));
    }

    @Test
    @DisplayName("Rule list must end with an unconditional fallback")
    void requiresFallback() {
        List<ConfidenceRule> rules = List.of(new ConfidenceRule("high", ConfidenceTier.HIGH,
                List.of(ConfidenceCriterion.assayCountAtLeast(2))));
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceRuleEngine(rules));
        assertThrows(IllegalArgumentException.class, () -> new ConfidenceRuleEngine(List.of()));
    }
}

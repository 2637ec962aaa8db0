package com.pathway.impact.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
    }

    @ParameterizedTest
    @DisplayName("Should normalize compound queries")
    @CsvSource(delimiter = '|', value = {
            "Imatinib|imatinib",
            "  Erlotinib   Hydrochloride |erlotinib hydrochloride",
            "Gleevec®|gleevec",
            "Tarceva™|tarceva",
            "aspirin 100 mg|aspirin",
            "aspirin 0.5 g|aspirin",
            "anti‐EGFR|anti-egfr"
    })
    void testCompoundQueries(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Should strip wrapping quotes")
    void testWrappingQuotes() {
        assertEquals("imatinib", engine.normalize("\"Imatinib\""));
        assertEquals("imatinib", engine.normalize("'imatinib'"));
    }

    @Test
    @DisplayName("Should keep inner digits that are not a dose")
    void testKeepsInnerDigits() {
        assertEquals("5-fluorouracil", engine.normalize("5-Fluorouracil"));
    }

    @Test
    @DisplayName("Custom rules apply in priority order regardless of insertion order")
    void testCustomRules() {
        NormalizationEngine custom = new NormalizationEngine();
        custom.addRule(NormalizationRule.of("salt-suffix", "\\s+mesylate$", "", 20));
        custom.addRule(NormalizationRule.of("brand-alias", "^imatinib mesylate$", "Gleevec", 10));

        assertEquals("gleevec", custom.normalize("Imatinib Mesylate"));
        assertEquals("nilotinib", custom.normalize("nilotinib mesylate"));
    }
}

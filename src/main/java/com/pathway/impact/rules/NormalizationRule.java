package com.pathway.impact.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Regex rewrite applied to a compound query before matching. Lower priority runs first.
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * Compiles {@code regex} case-insensitively (Unicode aware).
     */
    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        return new NormalizationRule(name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), replacement, priority);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }
}

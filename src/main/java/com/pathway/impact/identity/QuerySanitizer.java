package com.pathway.impact.identity;

import com.pathway.impact.error.ValidationException;

/**
 * Rejects free-text input that cannot be a compound query.
 */
public final class QuerySanitizer {

    public static final int MIN_LENGTH = 2;
    public static final int MAX_LENGTH = 255;

    private QuerySanitizer() {
    }

    /**
     * Returns the trimmed query.
     *
     * @throws ValidationException when the query is missing, too short, too long or
     *                             contains control characters
     */
    public static String sanitize(String query) {
        if (query == null) {
            throw new ValidationException("Query is required");
        }
        String trimmed = query.strip();
        if (trimmed.length() < MIN_LENGTH) {
            throw new ValidationException("Query must be at least " + MIN_LENGTH + " characters");
        }
        if (trimmed.length() > MAX_LENGTH) {
            throw new ValidationException("Query must be at most " + MAX_LENGTH + " characters");
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (Character.isISOControl(trimmed.charAt(i))) {
                throw new ValidationException("Query contains control characters");
            }
        }
        return trimmed;
    }
}

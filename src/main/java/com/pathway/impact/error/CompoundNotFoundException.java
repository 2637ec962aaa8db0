package com.pathway.impact.error;

/**
 * Thrown when a query resolves to no compound at all. Aborts an analysis run.
 */
public class CompoundNotFoundException extends PathwayImpactException {

    private final String query;

    public CompoundNotFoundException(String query) {
        super("No compound found for '" + query + "'");
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}

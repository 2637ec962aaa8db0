package com.pathway.impact.error;

/**
 * An external collaborator (identity search, activity provider, pathway source)
 * could not answer. Transient failures are retried by
 * {@link com.pathway.impact.upstream.RetryingInvoker}; permanent ones are not.
 */
public class UpstreamUnavailableException extends PathwayImpactException {

    private final String source;
    private final boolean transientFailure;

    public UpstreamUnavailableException(String source, String message) {
        this(source, message, true, null);
    }

    public UpstreamUnavailableException(String source, String message, Throwable cause) {
        this(source, message, true, cause);
    }

    public UpstreamUnavailableException(String source, String message, boolean transientFailure, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
        this.transientFailure = transientFailure;
    }

    public String getSource() {
        return source;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}

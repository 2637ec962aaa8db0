package com.pathway.impact.error;

/**
 * Base type for all failures raised by the pathway impact engine.
 * Subclasses map one-to-one onto the engine's error taxonomy so callers can
 * decide between surfacing, retrying, and degrading.
 */
public abstract class PathwayImpactException extends RuntimeException {

    protected PathwayImpactException(String message) {
        super(message);
    }

    protected PathwayImpactException(String message, Throwable cause) {
        super(message, cause);
    }
}

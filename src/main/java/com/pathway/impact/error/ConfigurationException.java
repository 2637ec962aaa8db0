package com.pathway.impact.error;

/**
 * Out-of-range parameters or mismatched parameter sets. Always raised before
 * any computation starts.
 */
public class ConfigurationException extends PathwayImpactException {

    public ConfigurationException(String message) {
        super(message);
    }
}

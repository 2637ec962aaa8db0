package com.pathway.impact.health;

/**
 * A single component probe: an upstream source, the hierarchy snapshot, and so on.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}

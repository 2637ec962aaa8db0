package com.pathway.impact.health;

import com.pathway.impact.upstream.UpstreamSource;

/**
 * Pings one upstream source. An unreachable critical source (the activity provider)
 * makes the engine DOWN; any other unreachable source only degrades it.
 */
public class UpstreamHealthCheck implements HealthCheck {

    private final UpstreamSource source;
    private final boolean critical;

    public UpstreamHealthCheck(UpstreamSource source, boolean critical) {
        this.source = source;
        this.critical = critical;
    }

    @Override
    public String getName() {
        return source.sourceName();
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        boolean reachable;
        try {
            reachable = source.ping();
        } catch (RuntimeException e) {
            reachable = false;
        }
        long latencyMs = System.currentTimeMillis() - startMs;

        HealthStatus base;
        if (reachable) {
            base = HealthStatus.up();
        } else if (critical) {
            base = HealthStatus.down(source.sourceName() + " unreachable");
        } else {
            base = HealthStatus.degraded(source.sourceName() + " unreachable");
        }
        String version;
        try {
            version = source.sourceVersion().orElse("unknown");
        } catch (RuntimeException e) {
            version = "unknown";
        }
        return base
                .withDetail("critical", critical)
                .withDetail("latencyMs", latencyMs)
                .withDetail("version", version);
    }
}

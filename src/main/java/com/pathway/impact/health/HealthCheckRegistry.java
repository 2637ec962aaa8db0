package com.pathway.impact.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every registered check and folds the results into one status.
 * The overall status is the worst individual one: any DOWN makes the engine DOWN,
 * otherwise any DEGRADED makes it DEGRADED.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public HealthCheckRegistry register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
        return this;
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }
        HealthStatus worst = HealthStatus.up();
        String worstName = null;
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            HealthStatus result = runSafely(check);
            results.put(check.getName(), result);
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }
        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        HealthStatus aggregate = new HealthStatus(worst.status(), message, Map.of());
        for (Map.Entry<String, HealthStatus> entry : results.entrySet()) {
            HealthStatus r = entry.getValue();
            aggregate = aggregate.withDetail(entry.getKey(), Map.of(
                    "status", r.status().name(),
                    "message", r.message(),
                    "details", r.details()));
        }
        return aggregate;
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus runSafely(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Health check threw: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}

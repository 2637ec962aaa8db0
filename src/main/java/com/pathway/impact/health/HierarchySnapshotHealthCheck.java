package com.pathway.impact.health;

import com.pathway.impact.hierarchy.HierarchyRegistry;
import com.pathway.impact.hierarchy.HierarchySnapshot;

import java.util.Optional;

/**
 * DOWN until a hierarchy snapshot has been published; reports its release otherwise.
 */
public class HierarchySnapshotHealthCheck implements HealthCheck {

    private final HierarchyRegistry registry;

    public HierarchySnapshotHealthCheck(HierarchyRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String getName() {
        return "hierarchy";
    }

    @Override
    public HealthStatus check() {
        Optional<HierarchySnapshot> snapshot = registry.current();
        if (snapshot.isEmpty()) {
            return HealthStatus.down("No pathway hierarchy snapshot published");
        }
        HierarchySnapshot current = snapshot.get();
        HealthStatus base = current.size() == 0
                ? HealthStatus.degraded("Published hierarchy is empty")
                : HealthStatus.up();
        return base
                .withDetail("release", current.releaseTag())
                .withDetail("pathways", current.size())
                .withDetail("integrityIssues", current.integrityIssues().size());
    }
}

package com.pathway.impact.hierarchy;

import com.pathway.impact.error.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the currently published hierarchy snapshot. Publishing swaps one reference,
 * so a reader sees either the old or the new complete snapshot, never a mix.
 * Runs capture the snapshot once at start and use it throughout.
 */
public class HierarchyRegistry {
    private static final Logger log = LoggerFactory.getLogger(HierarchyRegistry.class);

    public static final String SOURCE_NAME = "reactome";

    private final AtomicReference<HierarchySnapshot> current = new AtomicReference<>();

    public HierarchyRegistry() {
    }

    public HierarchyRegistry(HierarchySnapshot initial) {
        current.set(initial);
    }

    /**
     * Publishes a snapshot and returns the one it replaced, if any.
     */
    public Optional<HierarchySnapshot> publish(HierarchySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot is required");
        HierarchySnapshot previous = current.getAndSet(snapshot);
        log.info("hierarchy.published release={} previous={} pathways={}", snapshot.releaseTag(),
                previous != null ? previous.releaseTag() : "none", snapshot.size());
        return Optional.ofNullable(previous);
    }

    public Optional<HierarchySnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * @throws UpstreamUnavailableException when nothing has been published yet
     */
    public HierarchySnapshot require() {
        HierarchySnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new UpstreamUnavailableException(SOURCE_NAME, "no pathway hierarchy snapshot published", false, null);
        }
        return snapshot;
    }
}

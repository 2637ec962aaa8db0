package com.pathway.impact.upstream;

import java.util.Optional;

/**
 * Common surface of every external collaborator the engine consults.
 */
public interface UpstreamSource {

    /**
     * Stable source name used in version snapshots, logs and metrics (e.g. "chembl").
     */
    String sourceName();

    /**
     * Release or version of the data currently served, if the source reports one.
     */
    default Optional<String> sourceVersion() {
        return Optional.empty();
    }

    /**
     * Lightweight liveness probe. Implementations must not throw.
     */
    default boolean ping() {
        return true;
    }
}

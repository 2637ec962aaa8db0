package com.pathway.impact.hierarchy;

import com.pathway.impact.upstream.UpstreamSource;

/**
 * Pathway database (Reactome-like) feeding the nightly hierarchy build.
 */
public interface PathwaySource extends UpstreamSource {

    RawHierarchy fetchHierarchy();

    /**
     * @throws com.pathway.impact.error.UpstreamUnavailableException when the release cannot be read
     */
    String fetchReleaseVersion();
}

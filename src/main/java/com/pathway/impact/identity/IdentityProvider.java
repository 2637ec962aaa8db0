package com.pathway.impact.identity;

import com.pathway.impact.upstream.UpstreamSource;

import java.util.List;
import java.util.Optional;

/**
 * External compound search (ChEMBL-like). Implementations signal outages with
 * {@link com.pathway.impact.error.UpstreamUnavailableException}.
 */
public interface IdentityProvider extends UpstreamSource {

    /**
     * Returns every compound whose name or synonyms could match the normalized query.
     * The resolver does the ranking, so loose over-matching is fine.
     */
    List<CompoundRecord> search(String normalizedQuery);

    Optional<CompoundRecord> findByStructureKey(String structureKey);
}

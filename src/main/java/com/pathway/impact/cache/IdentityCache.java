package com.pathway.impact.cache;

import com.pathway.impact.core.model.CompoundIdentity;
import com.pathway.impact.core.model.ResolutionOutcome;

import java.util.Optional;

/**
 * Cache of resolved compound identities.
 *
 * <p>Writes are idempotent upserts keyed by canonical id. Concurrent first resolutions of
 * the same compound may race; last writer wins, which is safe because the value is a
 * pure function of the upstream record.</p>
 */
public interface IdentityCache {

    Optional<CompoundIdentity> get(String canonicalId);

    Optional<CompoundIdentity> findByStructureKey(String structureKey);

    void put(CompoundIdentity identity);

    /**
     * Returns the last resolved outcome served for a normalized query, used when the
     * identity search is unavailable.
     */
    Optional<ResolutionOutcome> getOutcome(String normalizedQuery);

    void putOutcome(String normalizedQuery, ResolutionOutcome outcome);

    void invalidateAll();

    CacheStats getStats();
}

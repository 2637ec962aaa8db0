package com.pathway.impact.cache;

import com.pathway.impact.core.model.CompoundIdentity;
import com.pathway.impact.core.model.ResolutionOutcome;

import java.util.Optional;

/**
 * Cache that stores nothing.
 */
public class NoOpIdentityCache implements IdentityCache {

    @Override
    public Optional<CompoundIdentity> get(String canonicalId) {
        return Optional.empty();
    }

    @Override
    public Optional<CompoundIdentity> findByStructureKey(String structureKey) {
        return Optional.empty();
    }

    @Override
    public void put(CompoundIdentity identity) {
    }

    @Override
    public Optional<ResolutionOutcome> getOutcome(String normalizedQuery) {
        return Optional.empty();
    }

    @Override
    public void putOutcome(String normalizedQuery, ResolutionOutcome outcome) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}

package com.pathway.impact.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.pathway.impact.core.model.CompoundIdentity;
import com.pathway.impact.core.model.ResolutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed identity cache with a structure-key index.
 */
public class CaffeineIdentityCache implements IdentityCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineIdentityCache.class);

    private final Cache<String, CompoundIdentity> identities;
    private final Cache<String, ResolutionOutcome> outcomes;
    // Secondary index: structureKey -> canonicalId
    private final ConcurrentMap<String, String> structureIndex = new ConcurrentHashMap<>();

    public CaffeineIdentityCache(CacheConfig config) {
        this.identities = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .removalListener((String canonicalId, CompoundIdentity identity, RemovalCause cause) -> {
                    if (identity != null && identity.structureKey() != null && cause.wasEvicted()) {
                        structureIndex.remove(identity.structureKey(), canonicalId);
                    }
                })
                .build();
        this.outcomes = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .build();
        log.info("CaffeineIdentityCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<CompoundIdentity> get(String canonicalId) {
        return Optional.ofNullable(identities.getIfPresent(canonicalId));
    }

    @Override
    public Optional<CompoundIdentity> findByStructureKey(String structureKey) {
        String canonicalId = structureIndex.get(structureKey);
        if (canonicalId == null) {
            return Optional.empty();
        }
        return get(canonicalId);
    }

    @Override
    public void put(CompoundIdentity identity) {
        identities.put(identity.canonicalId(), identity);
        if (identity.structureKey() != null) {
            structureIndex.put(identity.structureKey(), identity.canonicalId());
        }
    }

    @Override
    public Optional<ResolutionOutcome> getOutcome(String normalizedQuery) {
        return Optional.ofNullable(outcomes.getIfPresent(normalizedQuery));
    }

    @Override
    public void putOutcome(String normalizedQuery, ResolutionOutcome outcome) {
        outcomes.put(normalizedQuery, outcome);
    }

    @Override
    public void invalidateAll() {
        identities.invalidateAll();
        outcomes.invalidateAll();
        structureIndex.clear();
        log.debug("Invalidated all identity cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = identities.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                identities.estimatedSize()
        );
    }
}

package com.pathway.impact.cache;

import com.pathway.impact.error.ConfigurationException;

/**
 * Configuration for the compound identity cache.
 *
 * @param maxSize    maximum number of identities kept
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new ConfigurationException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new ConfigurationException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default cache configuration: 10,000 entries, 24h TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 86_400, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}

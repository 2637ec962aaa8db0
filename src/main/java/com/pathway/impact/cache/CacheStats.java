package com.pathway.impact.cache;

/**
 * Snapshot of identity cache statistics.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}

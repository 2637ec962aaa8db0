package com.pathway.impact.cache;

import com.pathway.impact.core.model.CompoundIdentity;
import com.pathway.impact.core.model.ResolutionOutcome;
import com.pathway.impact.error.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CaffeineIdentityCacheTest {

    private CaffeineIdentityCache cache;
    private final CompoundIdentity imatinib = CompoundIdentity.of("CHEMBL941", "IMATINIB",
            "KTUFNOKKBVMGRW-UHFFFAOYSA-N", List.of("Gleevec"));

    @BeforeEach
    void setUp() {
        cache = new CaffeineIdentityCache(new CacheConfig(100, 3600, true));
    }

    @Test
    @DisplayName("Should store and retrieve identities by canonical id and structure key")
    void testPutAndGet() {
        cache.put(imatinib);

        assertEquals(imatinib, cache.get("CHEMBL941").orElseThrow());
        assertEquals(imatinib, cache.findByStructureKey("KTUFNOKKBVMGRW-UHFFFAOYSA-N").orElseThrow());
        assertTrue(cache.get("CHEMBL553").isEmpty());
        assertTrue(cache.findByStructureKey("UNKNOWN").isEmpty());
    }

    @Test
    @DisplayName("Should keep the last outcome per normalized query")
    void testOutcomes() {
        ResolutionOutcome outcome = ResolutionOutcome.resolved("Imatinib", "imatinib", imatinib, List.of());
        cache.putOutcome("imatinib", outcome);

        assertEquals(outcome, cache.getOutcome("imatinib").orElseThrow());
        assertTrue(cache.getOutcome("gleevec").isEmpty());
    }

    @Test
    @DisplayName("Should clear everything on invalidateAll")
    void testInvalidateAll() {
        cache.put(imatinib);
        cache.putOutcome("imatinib", ResolutionOutcome.notFound("x", "x"));

        cache.invalidateAll();

        assertTrue(cache.get("CHEMBL941").isEmpty());
        assertTrue(cache.findByStructureKey("KTUFNOKKBVMGRW-UHFFFAOYSA-N").isEmpty());
        assertTrue(cache.getOutcome("imatinib").isEmpty());
    }

    @Test
    @DisplayName("Should count hits and misses")
    void testStats() {
        cache.put(imatinib);
        cache.get("CHEMBL941");
        cache.get("CHEMBL941");
        cache.get("CHEMBL553");

        CacheStats stats = cache.getStats();
        assertEquals(2, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(2.0 / 3, stats.hitRate(), 1e-9);
        assertEquals(0.0, CacheStats.empty().hitRate());
    }

    @Test
    @DisplayName("No-op cache never stores anything")
    void testNoOpCache() {
        NoOpIdentityCache noOp = new NoOpIdentityCache();
        noOp.put(imatinib);

        assertTrue(noOp.get("CHEMBL941").isEmpty());
        assertEquals(CacheStats.empty(), noOp.getStats());
    }

    @Test
    @DisplayName("Should reject non-positive sizes")
    void testConfigValidation() {
        assertThrows(ConfigurationException.class, () -> new CacheConfig(0, 10, true));
        assertThrows(ConfigurationException.class, () -> new CacheConfig(10, 0, true));
        assertFalse(CacheConfig.disabled().enabled());
    }
}

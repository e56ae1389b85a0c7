package com.attribution.consolidation.cache;

import com.attribution.consolidation.core.model.AttributionConsolidation;

import java.util.Optional;

/**
 * No-op cache implementation. Used when caching is disabled.
 */
public class NoOpConsolidationCache implements ConsolidationCache {

    @Override
    public Optional<AttributionConsolidation> get(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public void put(CacheKey key, AttributionConsolidation consolidation) {
        // no-op
    }

    @Override
    public void clear(CacheKey key) {
        // no-op
    }

    @Override
    public int invalidateAddress(String address, String blockchain) {
        return 0;
    }

    @Override
    public void clear() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}

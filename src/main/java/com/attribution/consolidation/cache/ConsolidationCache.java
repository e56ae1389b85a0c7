package com.attribution.consolidation.cache;

import com.attribution.consolidation.core.model.AttributionConsolidation;

import java.util.Optional;

/**
 * Cache of consolidation results keyed by {@link CacheKey}.
 * Only found consolidations are cached; a miss always re-queries the sources.
 */
public interface ConsolidationCache {

    /**
     * Gets a cached consolidation.
     *
     * @return the cached consolidation, or empty if absent or expired
     */
    Optional<AttributionConsolidation> get(CacheKey key);

    void put(CacheKey key, AttributionConsolidation consolidation);

    /**
     * Removes one entry.
     */
    void clear(CacheKey key);

    /**
     * Removes every filter variant cached for an address.
     *
     * @return the number of entries removed
     */
    int invalidateAddress(String address, String blockchain);

    /**
     * Removes all entries.
     */
    void clear();

    CacheStats getStats();
}

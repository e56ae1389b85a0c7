package com.attribution.consolidation.cache;

import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caffeine-backed consolidation cache with an address index for invalidating every
 * filter variant of one address at once.
 *
 * <p>Entries expire {@code ttlSeconds} after being written; an expired entry is never
 * returned, whether or not Caffeine has cleaned it up yet.</p>
 */
public class CaffeineConsolidationCache implements ConsolidationCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineConsolidationCache.class);

    private final Cache<CacheKey, AttributionConsolidation> cache;
    // Secondary index: blockchain:address -> cache keys for that address
    private final ConcurrentMap<String, Set<CacheKey>> addressIndex = new ConcurrentHashMap<>();

    public CaffeineConsolidationCache(CacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    /**
     * Creates a cache reading time from the given ticker.
     */
    public CaffeineConsolidationCache(CacheConfig config, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .removalListener((CacheKey key, AttributionConsolidation value, RemovalCause cause) -> {
                    if (key != null && cause.wasEvicted()) {
                        removeFromIndex(key);
                    }
                })
                .build();
        log.info("CaffeineConsolidationCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<AttributionConsolidation> get(CacheKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(CacheKey key, AttributionConsolidation consolidation) {
        cache.put(key, consolidation);
        addressIndex.computeIfAbsent(key.addressKey(), k -> ConcurrentHashMap.newKeySet()).add(key);
    }

    @Override
    public void clear(CacheKey key) {
        cache.invalidate(key);
        removeFromIndex(key);
    }

    @Override
    public int invalidateAddress(String address, String blockchain) {
        Set<CacheKey> keys = addressIndex.remove(CacheKey.addressKey(address, blockchain));
        if (keys == null) {
            return 0;
        }
        cache.invalidateAll(keys);
        log.debug("cache.invalidated address={} blockchain={} entries={}", address, blockchain, keys.size());
        return keys.size();
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        addressIndex.clear();
        log.debug("cache.cleared");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    private void removeFromIndex(CacheKey key) {
        addressIndex.computeIfPresent(key.addressKey(), (k, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
    }
}

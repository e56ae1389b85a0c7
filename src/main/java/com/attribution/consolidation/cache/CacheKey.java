package com.attribution.consolidation.cache;

import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Identifies one cached consolidation: a normalized address and chain plus the query filters.
 * The source filter is held sorted, so its order never changes the key.
 *
 * @param address       normalized address
 * @param blockchain    lower-cased chain name
 * @param sources       source filter; empty means every source
 * @param minConfidence minimum confidence filter, or {@code null} for none
 */
public record CacheKey(String address, String blockchain, SortedSet<String> sources, ConfidenceLevel minConfidence) {

    public CacheKey {
        Objects.requireNonNull(address, "address is required");
        Objects.requireNonNull(blockchain, "blockchain is required");
        sources = Collections.unmodifiableSortedSet(sources != null ? new TreeSet<>(sources) : new TreeSet<>());
    }

    public static CacheKey of(String address, String blockchain, Set<String> sources, ConfidenceLevel minConfidence) {
        return new CacheKey(address, blockchain, sources != null ? new TreeSet<>(sources) : null, minConfidence);
    }

    /**
     * Key of the address this entry belongs to, shared by every filter variant.
     */
    public String addressKey() {
        return addressKey(address, blockchain);
    }

    static String addressKey(String address, String blockchain) {
        return blockchain + ":" + address;
    }

    @Override
    public String toString() {
        return address + ":" + blockchain + ":" + (minConfidence != null ? minConfidence.wireName() : "any")
                + ":" + String.join(",", sources);
    }
}

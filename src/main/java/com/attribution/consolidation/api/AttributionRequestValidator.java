package com.attribution.consolidation.api;

import com.attribution.consolidation.core.model.SourceNames;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Input validation for attribution queries. Every method throws
 * {@link IllegalArgumentException} before any source is contacted.
 */
public final class AttributionRequestValidator {

    /** Maximum allowed length for an address. */
    public static final int MAX_ADDRESS_LENGTH = 255;

    public static final int MIN_WINDOW_DAYS = 1;
    public static final int MAX_WINDOW_DAYS = 365;
    public static final int MIN_SEARCH_LIMIT = 1;
    public static final int MAX_SEARCH_LIMIT = 1000;
    public static final int DEFAULT_SEARCH_LIMIT = 100;

    public static final Set<String> SUPPORTED_BLOCKCHAINS = Set.of(
            "bitcoin", "ethereum", "binance_smart_chain", "bsc", "polygon", "arbitrum",
            "optimism", "base", "solana", "tron", "xrpl", "avalanche", "fantom", "heco",
            "celo", "moonbeam");

    /** EVM chains whose hex addresses are case-insensitive. */
    public static final Set<String> CASE_INSENSITIVE_BLOCKCHAINS = Set.of(
            "ethereum", "polygon", "bsc", "binance_smart_chain", "avalanche", "fantom",
            "arbitrum", "optimism", "base", "celo", "moonbeam");

    private AttributionRequestValidator() {
        // utility class
    }

    /**
     * Validates a blockchain name and returns it lower-cased.
     */
    public static String normalizeBlockchain(String blockchain) {
        if (blockchain == null || blockchain.isBlank()) {
            throw new IllegalArgumentException("Blockchain must not be null or blank");
        }
        String normalized = blockchain.trim().toLowerCase(Locale.ROOT);
        if (!SUPPORTED_BLOCKCHAINS.contains(normalized)) {
            throw new IllegalArgumentException("Unsupported blockchain: '" + blockchain + "'");
        }
        return normalized;
    }

    /**
     * Validates an address and returns its lookup form: lower-cased on case-insensitive
     * chains, unchanged elsewhere.
     *
     * @param normalizedBlockchain a chain already returned by {@link #normalizeBlockchain}
     */
    public static String normalizeAddress(String address, String normalizedBlockchain) {
        validateAddress(address);
        return CASE_INSENSITIVE_BLOCKCHAINS.contains(normalizedBlockchain)
                ? address.toLowerCase(Locale.ROOT)
                : address;
    }

    /**
     * Rejects null, blank, overly long, whitespace- or control-character-containing addresses.
     */
    public static void validateAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address must not be null or blank");
        }
        if (address.length() > MAX_ADDRESS_LENGTH) {
            throw new IllegalArgumentException(
                    "Address exceeds maximum length of " + MAX_ADDRESS_LENGTH +
                            " characters (was " + address.length() + ")");
        }
        for (int i = 0; i < address.length(); i++) {
            char c = address.charAt(i);
            if (Character.isWhitespace(c) || Character.isISOControl(c)) {
                throw new IllegalArgumentException("Address must not contain whitespace or control characters");
            }
        }
    }

    public static void validateSources(Collection<String> sources) {
        if (sources == null) {
            return;
        }
        for (String source : sources) {
            if (source == null || !SourceNames.ALL.contains(source)) {
                throw new IllegalArgumentException("Unknown source: '" + source + "'");
            }
        }
    }

    /**
     * Validates the size and the entries of a batch request.
     */
    public static void validateBatch(List<String> addresses, int maxBatchSize) {
        if (addresses == null || addresses.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one address");
        }
        if (addresses.size() > maxBatchSize) {
            throw new IllegalArgumentException(
                    "Batch exceeds maximum size of " + maxBatchSize + " addresses (was " + addresses.size() + ")");
        }
        addresses.forEach(AttributionRequestValidator::validateAddress);
    }

    public static void validateWindowDays(int days) {
        if (days < MIN_WINDOW_DAYS || days > MAX_WINDOW_DAYS) {
            throw new IllegalArgumentException(
                    "Window must be between " + MIN_WINDOW_DAYS + " and " + MAX_WINDOW_DAYS + " days (was " + days + ")");
        }
    }

    public static void validateLimit(int limit) {
        if (limit < MIN_SEARCH_LIMIT || limit > MAX_SEARCH_LIMIT) {
            throw new IllegalArgumentException(
                    "Limit must be between " + MIN_SEARCH_LIMIT + " and " + MAX_SEARCH_LIMIT + " (was " + limit + ")");
        }
    }

    public static void validateEntity(String entity) {
        if (entity == null || entity.isBlank()) {
            throw new IllegalArgumentException("Entity must not be null or blank");
        }
        if (entity.length() > MAX_ADDRESS_LENGTH) {
            throw new IllegalArgumentException(
                    "Entity exceeds maximum length of " + MAX_ADDRESS_LENGTH + " characters");
        }
    }
}

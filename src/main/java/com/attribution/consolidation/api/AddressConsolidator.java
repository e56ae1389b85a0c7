package com.attribution.consolidation.api;

import com.attribution.consolidation.core.model.AttributionConsolidation;

import java.util.Optional;

/**
 * Consolidates a single address. Implementations may throw; {@link BatchOrchestrator}
 * isolates such failures per item.
 */
@FunctionalInterface
public interface AddressConsolidator {

    Optional<AttributionConsolidation> consolidate(String address, String blockchain, ConsolidationOptions options);
}

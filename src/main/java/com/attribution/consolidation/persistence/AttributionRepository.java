package com.attribution.consolidation.persistence;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for consolidated attributions.
 * Implementations provide different storage backends; {@link InMemoryAttributionRepository} is the default.
 */
public interface AttributionRepository {

    /**
     * Upserts a consolidation keyed by (address, blockchain) and each of its attributions keyed by id.
     */
    void saveConsolidation(AttributionConsolidation consolidation);

    Optional<AttributionConsolidation> findConsolidation(String address, String blockchain);

    /**
     * Finds attributions naming an entity, newest first.
     *
     * @param entity     entity name, matched case-insensitively
     * @param blockchain optional chain filter, {@code null} for all chains
     * @param confidence optional exact confidence filter, {@code null} for any
     * @param limit      maximum number of results
     */
    List<Attribution> findAttributionsByEntity(String entity, String blockchain, ConfidenceLevel confidence, int limit);

    /**
     * Finds consolidations with the given overall confidence.
     */
    List<AttributionConsolidation> findConsolidationsByConfidence(ConfidenceLevel level);

    /**
     * Finds consolidations whose sources disagree, newest first.
     *
     * @param blockchain optional chain filter, {@code null} for all chains
     */
    List<AttributionConsolidation> findConflictingConsolidations(String blockchain);

    /**
     * Finds consolidations written at or after the given instant.
     */
    List<AttributionConsolidation> findConsolidationsSince(Instant since);

    /**
     * Finds attributions created at or after the given instant.
     */
    List<Attribution> findAttributionsSince(Instant since);
}

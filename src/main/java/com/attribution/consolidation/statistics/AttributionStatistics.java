package com.attribution.consolidation.statistics;

import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counts over the attributions and consolidations persisted within a time window.
 *
 * @param windowDays             size of the window, in days
 * @param totalAttributions      attributions created in the window
 * @param uniqueAddresses        distinct addresses among them
 * @param uniqueEntities         distinct named entities among them
 * @param uniqueBlockchains      distinct chains among them
 * @param averageRiskScore       mean attribution risk score, 0.0 when there are none
 * @param totalConsolidations    consolidations written in the window
 * @param averageConsolidationScore mean consolidation score, 0.0 when there are none
 * @param withConflicts          consolidations with conflicting sources
 * @param withSupport            consolidations with supporting sources
 * @param confidenceDistribution attribution count per confidence level
 * @param sourceDistribution     attribution count per contributing source
 * @param generatedAt            when these figures were computed
 */
public record AttributionStatistics(
        int windowDays,
        long totalAttributions,
        long uniqueAddresses,
        long uniqueEntities,
        long uniqueBlockchains,
        double averageRiskScore,
        long totalConsolidations,
        double averageConsolidationScore,
        long withConflicts,
        long withSupport,
        Map<ConfidenceLevel, Long> confidenceDistribution,
        Map<String, Long> sourceDistribution,
        Instant generatedAt
) {

    public AttributionStatistics {
        confidenceDistribution = confidenceDistribution == null || confidenceDistribution.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(confidenceDistribution));
        sourceDistribution = sourceDistribution == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(sourceDistribution));
    }

    /**
     * Share of consolidations with conflicting sources (0.0 to 1.0).
     */
    public double conflictRate() {
        return totalConsolidations == 0 ? 0.0 : (double) withConflicts / totalConsolidations;
    }
}

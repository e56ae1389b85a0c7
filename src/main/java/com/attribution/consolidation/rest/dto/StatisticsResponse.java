package com.attribution.consolidation.rest.dto;

import com.attribution.consolidation.core.model.ConfidenceLevel;
import com.attribution.consolidation.statistics.AttributionStatistics;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response DTO for attribution statistics.
 */
public record StatisticsResponse(
        @JsonProperty("window_days") int windowDays,
        @JsonProperty("total_attributions") long totalAttributions,
        @JsonProperty("unique_addresses") long uniqueAddresses,
        @JsonProperty("unique_entities") long uniqueEntities,
        @JsonProperty("unique_blockchains") long uniqueBlockchains,
        @JsonProperty("avg_risk_score") double averageRiskScore,
        @JsonProperty("total_consolidations") long totalConsolidations,
        @JsonProperty("avg_consolidation_score") double averageConsolidationScore,
        @JsonProperty("with_conflicts") long withConflicts,
        @JsonProperty("with_support") long withSupport,
        @JsonProperty("confidence_distribution") Map<String, Long> confidenceDistribution,
        @JsonProperty("source_distribution") Map<String, Long> sourceDistribution,
        @JsonProperty("generated_at") Instant generatedAt
) {
    public static StatisticsResponse from(AttributionStatistics statistics) {
        Map<String, Long> byConfidence = new LinkedHashMap<>();
        for (ConfidenceLevel level : ConfidenceLevel.values()) {
            byConfidence.put(level.wireName(), statistics.confidenceDistribution().getOrDefault(level, 0L));
        }
        return new StatisticsResponse(
                statistics.windowDays(),
                statistics.totalAttributions(),
                statistics.uniqueAddresses(),
                statistics.uniqueEntities(),
                statistics.uniqueBlockchains(),
                statistics.averageRiskScore(),
                statistics.totalConsolidations(),
                statistics.averageConsolidationScore(),
                statistics.withConflicts(),
                statistics.withSupport(),
                byConfidence,
                statistics.sourceDistribution(),
                statistics.generatedAt()
        );
    }
}

package com.attribution.consolidation.rest.dto;

import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Response DTO for a consolidated attribution.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConsolidationResponse(
        @JsonProperty("address") String address,
        @JsonProperty("blockchain") String blockchain,
        @JsonProperty("consolidated_entity") String consolidatedEntity,
        @JsonProperty("consolidated_entity_type") String consolidatedEntityType,
        @JsonProperty("overall_confidence") String overallConfidence,
        @JsonProperty("consolidation_score") double consolidationScore,
        @JsonProperty("supporting_sources") Set<String> supportingSources,
        @JsonProperty("conflicting_sources") Set<String> conflictingSources,
        @JsonProperty("evidence") List<String> evidence,
        @JsonProperty("attributions") List<AttributionResponse> attributions,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("consolidated_at") Instant consolidatedAt
) {
    public static ConsolidationResponse from(AttributionConsolidation consolidation) {
        return new ConsolidationResponse(
                consolidation.getAddress(),
                consolidation.getBlockchain(),
                consolidation.getConsolidatedEntity(),
                consolidation.getConsolidatedEntityType(),
                consolidation.getOverallConfidence().wireName(),
                consolidation.getConsolidationScore(),
                consolidation.getSupportingSources(),
                consolidation.getConflictingSources(),
                consolidation.getEvidence(),
                consolidation.getAttributions().stream().map(AttributionResponse::from).toList(),
                consolidation.getMetadata(),
                consolidation.getConsolidatedAt()
        );
    }
}

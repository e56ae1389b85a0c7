package com.attribution.consolidation.rest.dto;

import com.attribution.consolidation.core.model.Attribution;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a single source's attribution.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AttributionResponse(
        @JsonProperty("id") String id,
        @JsonProperty("address") String address,
        @JsonProperty("blockchain") String blockchain,
        @JsonProperty("entity") String entity,
        @JsonProperty("entity_type") String entityType,
        @JsonProperty("confidence") String confidence,
        @JsonProperty("sources") List<SourceContributionResponse> sources,
        @JsonProperty("evidence") List<String> evidence,
        @JsonProperty("risk_score") double riskScore,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("created_at") Instant createdAt
) {
    public static AttributionResponse from(Attribution attribution) {
        return new AttributionResponse(
                attribution.getId(),
                attribution.getAddress(),
                attribution.getBlockchain(),
                attribution.getEntity(),
                attribution.getEntityType(),
                attribution.getConfidence().wireName(),
                attribution.getSources().stream().map(SourceContributionResponse::from).toList(),
                attribution.getEvidence(),
                attribution.getRiskScore(),
                attribution.getTags(),
                attribution.getMetadata(),
                attribution.getCreatedAt()
        );
    }
}

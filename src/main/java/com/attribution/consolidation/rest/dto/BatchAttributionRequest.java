package com.attribution.consolidation.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for batch consolidation. Only {@code addresses} and {@code blockchain} are required.
 */
public record BatchAttributionRequest(
        @JsonProperty("addresses") List<String> addresses,
        @JsonProperty("blockchain") String blockchain,
        @JsonProperty("sources") List<String> sources,
        @JsonProperty("min_confidence") String minConfidence,
        @JsonProperty("max_concurrent") Integer maxConcurrent
) {
    public BatchAttributionRequest {
        if (addresses == null || addresses.isEmpty()) {
            throw new IllegalArgumentException("addresses must not be empty");
        }
        if (blockchain == null || blockchain.isBlank()) {
            throw new IllegalArgumentException("blockchain is required");
        }
    }
}

package com.attribution.consolidation.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for batch consolidation. {@code results} holds one entry per distinct address,
 * {@code null} where nothing was found.
 */
public record BatchAttributionResponse(
        @JsonProperty("results") Map<String, ConsolidationResponse> results,
        @JsonProperty("total_addresses") int totalAddresses,
        @JsonProperty("successful_attributions") int successfulAttributions,
        @JsonProperty("unattributed_addresses") List<String> unattributedAddresses,
        @JsonProperty("processing_time_ms") long processingTimeMs
) {
}

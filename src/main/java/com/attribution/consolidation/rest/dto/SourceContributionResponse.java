package com.attribution.consolidation.rest.dto;

import com.attribution.consolidation.core.model.SourceContribution;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceContributionResponse(
        @JsonProperty("source_name") String sourceName,
        @JsonProperty("raw_confidence") double rawConfidence,
        @JsonProperty("evidence") List<String> evidence,
        @JsonProperty("observed_at") Instant observedAt
) {
    public static SourceContributionResponse from(SourceContribution contribution) {
        return new SourceContributionResponse(
                contribution.sourceName(),
                contribution.rawConfidence(),
                contribution.evidence(),
                contribution.observedAt()
        );
    }
}

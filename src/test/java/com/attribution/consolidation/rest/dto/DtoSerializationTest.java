package com.attribution.consolidation.rest.dto;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;
import com.attribution.consolidation.core.model.SourceContribution;
import com.attribution.consolidation.core.model.SourceNames;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("REST DTO serialization Tests")
class DtoSerializationTest {

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Test
    @DisplayName("Consolidation responses use snake_case names and omit nulls")
    void consolidationJson() throws Exception {
        AttributionConsolidation consolidation = AttributionConsolidation.builder()
                .address("0xabc")
                .blockchain("ethereum")
                .attributions(List.of(Attribution.builder()
                        .address("0xabc")
                        .blockchain("ethereum")
                        .entity("Exchange")
                        .source(SourceContribution.of(SourceNames.VICTIM_REPORTS, 0.8))
                        .riskScore(0.3)
                        .build()))
                .consolidatedEntity("Exchange")
                .overallConfidence(ConfidenceLevel.VERY_HIGH)
                .supportingSources(Set.of(SourceNames.VICTIM_REPORTS))
                .consolidationScore(0.85)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(ConsolidationResponse.from(consolidation)));

        assertEquals("Exchange", json.get("consolidated_entity").asText());
        assertEquals("very_high", json.get("overall_confidence").asText());
        assertEquals(0.85, json.get("consolidation_score").asDouble(), 1e-9);
        assertEquals("victim_reports", json.get("supporting_sources").get(0).asText());
        assertTrue(json.get("conflicting_sources").isEmpty());
        assertFalse(json.has("consolidated_entity_type"));
        JsonNode attribution = json.get("attributions").get(0);
        assertEquals(0.3, attribution.get("risk_score").asDouble(), 1e-9);
        assertEquals("victim_reports", attribution.get("sources").get(0).get("source_name").asText());
        assertEquals(0.8, attribution.get("sources").get(0).get("raw_confidence").asDouble(), 1e-9);
    }

    @Test
    @DisplayName("Batch requests read snake_case fields")
    void batchRequest() throws Exception {
        BatchAttributionRequest request = mapper.readValue(
                "{\"addresses\": [\"0x1\", \"0x2\"], \"blockchain\": \"ethereum\", "
                        + "\"sources\": [\"vasp_registry\"], \"min_confidence\": \"high\", \"max_concurrent\": 5}",
                BatchAttributionRequest.class);

        assertEquals(List.of("0x1", "0x2"), request.addresses());
        assertEquals("high", request.minConfidence());
        assertEquals(5, request.maxConcurrent());
        assertEquals(List.of("vasp_registry"), request.sources());
    }

    @Test
    @DisplayName("Batch requests without addresses are rejected")
    void batchRequestValidation() {
        assertThrows(JsonMappingException.class,
                () -> mapper.readValue("{\"addresses\": [], \"blockchain\": \"ethereum\"}", BatchAttributionRequest.class));
        assertThrows(IllegalArgumentException.class,
                () -> new BatchAttributionRequest(List.of("0x1"), " ", null, null, null));
    }

    @Test
    @DisplayName("Error responses carry the status and path")
    void errorJson() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(
                ErrorResponse.notFound("No attribution found", "/api/v1/attributions/ethereum/0xabc")));

        assertEquals(404, json.get("status").asInt());
        assertEquals("Not Found", json.get("error").asText());
        assertEquals("/api/v1/attributions/ethereum/0xabc", json.get("path").asText());
    }
}

package com.attribution.consolidation.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Attribution model Tests")
class AttributionTest {

    private Attribution.Builder validAttribution() {
        return Attribution.builder()
                .address("0xabc")
                .blockchain("ethereum")
                .entity("Exchange")
                .source(SourceContribution.of(SourceNames.VICTIM_REPORTS, 0.8));
    }

    @Nested
    @DisplayName("SourceContribution")
    class SourceContributionTests {

        @Test
        @DisplayName("Should reject raw confidence outside [0, 1]")
        void rejectsOutOfRange() {
            assertThrows(IllegalArgumentException.class, () -> SourceContribution.of("victim_reports", 1.01));
            assertThrows(IllegalArgumentException.class, () -> SourceContribution.of("victim_reports", -0.1));
            assertThrows(IllegalArgumentException.class, () -> SourceContribution.of("victim_reports", Double.NaN));
        }

        @Test
        @DisplayName("Should accept unknown source names")
        void acceptsUnknownSource() {
            SourceContribution contribution = SourceContribution.of("dark_web_forum", 0.4);
            assertEquals("dark_web_forum", contribution.sourceName());
            assertNotNull(contribution.observedAt());
        }
    }

    @Nested
    @DisplayName("Attribution")
    class AttributionTests {

        @Test
        @DisplayName("Should require at least one source contribution")
        void requiresSource() {
            assertThrows(IllegalArgumentException.class, () -> Attribution.builder()
                    .address("0xabc")
                    .blockchain("ethereum")
                    .build());
        }

        @Test
        @DisplayName("Should group an absent entity as unknown")
        void blankEntityIsUnknown() {
            Attribution attribution = validAttribution().entity("  ").build();
            assertNull(attribution.getEntity());
            assertEquals(Attribution.UNKNOWN_ENTITY, attribution.getEntityKey());
        }

        @Test
        @DisplayName("Should derive confidence from the first contribution")
        void derivesConfidence() {
            assertEquals(ConfidenceLevel.HIGH, validAttribution().build().getConfidence());
        }

        @Test
        @DisplayName("Should defensively copy collections")
        void copiesCollections() {
            List<String> evidence = new ArrayList<>(List.of("tx:1"));
            Attribution attribution = validAttribution().evidence(evidence).build();
            evidence.add("tx:2");

            assertEquals(List.of("tx:1"), attribution.getEvidence());
            assertThrows(UnsupportedOperationException.class, () -> attribution.getTags().add("x"));
        }

        @Test
        @DisplayName("Should reject risk score outside [0, 1]")
        void rejectsRisk() {
            assertThrows(IllegalArgumentException.class, () -> validAttribution().riskScore(1.5).build());
        }
    }

    @Nested
    @DisplayName("AttributionConsolidation")
    class ConsolidationTests {

        private AttributionConsolidation.Builder consolidation() {
            return AttributionConsolidation.builder()
                    .address("0xabc")
                    .blockchain("ethereum")
                    .attributions(List.of(validAttribution().build()))
                    .consolidatedEntity("Exchange")
                    .overallConfidence(ConfidenceLevel.HIGH)
                    .consolidationScore(0.8);
        }

        @Test
        @DisplayName("Should reject both supporting and conflicting sources")
        void rejectsBothSets() {
            assertThrows(IllegalArgumentException.class, () -> consolidation()
                    .supportingSources(Set.of("victim_reports"))
                    .conflictingSources(Set.of("threat_intelligence"))
                    .build());
        }

        @Test
        @DisplayName("Should reject neither supporting nor conflicting sources")
        void rejectsNeitherSet() {
            assertThrows(IllegalArgumentException.class, () -> consolidation().build());
        }

        @Test
        @DisplayName("Should reject an empty attribution list")
        void rejectsNoAttributions() {
            assertThrows(IllegalArgumentException.class, () -> consolidation()
                    .attributions(List.of())
                    .supportingSources(Set.of("victim_reports"))
                    .build());
        }

        @Test
        @DisplayName("Should expose conflict state")
        void exposesConflicts() {
            AttributionConsolidation result = consolidation()
                    .conflictingSources(Set.of("victim_reports", "threat_intelligence"))
                    .build();
            assertTrue(result.hasConflicts());
            assertTrue(result.getSupportingSources().isEmpty());
            assertEquals("threat_intelligence", result.getConflictingSources().first());
        }
    }
}

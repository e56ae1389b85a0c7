package com.attribution.consolidation.api;

import com.attribution.consolidation.core.model.ConfidenceLevel;
import com.attribution.consolidation.core.model.SourceNames;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AttributionRequestValidator Tests")
class AttributionRequestValidatorTest {

    @Nested
    @DisplayName("Blockchain")
    class Blockchain {

        @Test
        @DisplayName("Should lower-case and trim supported chains")
        void normalizes() {
            assertEquals("ethereum", AttributionRequestValidator.normalizeBlockchain(" Ethereum "));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "  ", "dogecoin", "eth"})
        @DisplayName("Should reject blank or unsupported chains")
        void rejects(String chain) {
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.normalizeBlockchain(chain));
        }

        @Test
        @DisplayName("Should reject null")
        void rejectsNull() {
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.normalizeBlockchain(null));
        }
    }

    @Nested
    @DisplayName("Address")
    class Address {

        @Test
        @DisplayName("EVM addresses are lower-cased")
        void evmLowerCase() {
            assertEquals("0xabcdef", AttributionRequestValidator.normalizeAddress("0xABCdef", "ethereum"));
            assertEquals("0xabcdef", AttributionRequestValidator.normalizeAddress("0xABCdef", "polygon"));
        }

        @Test
        @DisplayName("Other chains keep the address as given")
        void caseSensitiveChains() {
            assertEquals("bc1QxYz", AttributionRequestValidator.normalizeAddress("bc1QxYz", "bitcoin"));
            assertEquals("So1anaAddr", AttributionRequestValidator.normalizeAddress("So1anaAddr", "solana"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", " ", "0xab cd", "0xab\tcd", "0xab\u0007cd"})
        @DisplayName("Should reject blank, whitespace and control characters")
        void rejectsMalformed(String address) {
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateAddress(address));
        }

        @Test
        @DisplayName("Should reject addresses longer than the maximum")
        void rejectsTooLong() {
            String longAddress = "a".repeat(AttributionRequestValidator.MAX_ADDRESS_LENGTH + 1);
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateAddress(longAddress));
            assertDoesNotThrow(() -> AttributionRequestValidator.validateAddress(
                    "a".repeat(AttributionRequestValidator.MAX_ADDRESS_LENGTH)));
        }
    }

    @Nested
    @DisplayName("Batch and query bounds")
    class Bounds {

        @Test
        @DisplayName("Should reject empty and oversized batches")
        void batchSize() {
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateBatch(List.of(), 10));
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateBatch(null, 10));
            assertThrows(IllegalArgumentException.class,
                    () -> AttributionRequestValidator.validateBatch(List.of("a", "b", "c"), 2));
            assertDoesNotThrow(() -> AttributionRequestValidator.validateBatch(List.of("a", "b"), 2));
        }

        @Test
        @DisplayName("One malformed address fails the whole batch")
        void batchEntries() {
            assertThrows(IllegalArgumentException.class,
                    () -> AttributionRequestValidator.validateBatch(List.of("0xabc", " "), 10));
            assertThrows(IllegalArgumentException.class,
                    () -> AttributionRequestValidator.validateBatch(Collections.singletonList(null), 10));
        }

        @Test
        @DisplayName("Window days must be between 1 and 365")
        void windowDays() {
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateWindowDays(0));
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateWindowDays(366));
            assertDoesNotThrow(() -> AttributionRequestValidator.validateWindowDays(365));
        }

        @Test
        @DisplayName("Search limit must be between 1 and 1000")
        void limit() {
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateLimit(0));
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateLimit(1001));
            assertDoesNotThrow(() -> AttributionRequestValidator.validateLimit(1));
        }

        @Test
        @DisplayName("Entity must not be blank")
        void entity() {
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateEntity(" "));
            assertThrows(IllegalArgumentException.class, () -> AttributionRequestValidator.validateEntity(null));
        }
    }

    @Nested
    @DisplayName("ConsolidationOptions")
    class Options {

        @Test
        @DisplayName("Defaults query every source with no confidence floor")
        void defaults() {
            ConsolidationOptions options = ConsolidationOptions.defaults();

            assertTrue(options.getSources().isEmpty());
            assertNull(options.getMinConfidence());
            assertEquals(10, options.getMaxConcurrent());
            assertEquals(Duration.ofSeconds(10), options.getSourceTimeout());
            assertEquals(100, options.getMaxBatchSize());
        }

        @Test
        @DisplayName("Should reject unknown source names")
        void unknownSource() {
            assertThrows(IllegalArgumentException.class,
                    () -> ConsolidationOptions.builder().sources(List.of("dark_web_forum")).build());
        }

        @Test
        @DisplayName("Should reject non-positive limits")
        void limits() {
            assertThrows(IllegalArgumentException.class, () -> ConsolidationOptions.builder().maxConcurrent(0));
            assertThrows(IllegalArgumentException.class, () -> ConsolidationOptions.builder().maxBatchSize(-1));
            assertThrows(IllegalArgumentException.class,
                    () -> ConsolidationOptions.builder().sourceTimeout(Duration.ZERO));
        }

        @Test
        @DisplayName("toBuilder keeps every option")
        void toBuilder() {
            ConsolidationOptions original = ConsolidationOptions.builder()
                    .sources(List.of(SourceNames.VASP_REGISTRY, SourceNames.VICTIM_REPORTS))
                    .minConfidence(ConfidenceLevel.HIGH)
                    .maxConcurrent(3)
                    .build();

            ConsolidationOptions copy = original.toBuilder().maxBatchSize(5).build();

            assertEquals(List.of(SourceNames.VASP_REGISTRY, SourceNames.VICTIM_REPORTS), List.copyOf(copy.getSources()));
            assertEquals(ConfidenceLevel.HIGH, copy.getMinConfidence());
            assertEquals(3, copy.getMaxConcurrent());
            assertEquals(5, copy.getMaxBatchSize());
        }
    }
}

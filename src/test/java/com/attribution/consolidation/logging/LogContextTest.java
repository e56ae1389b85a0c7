package com.attribution.consolidation.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Consolidation context sets and removes its keys")
    void consolidation() {
        try (LogContext ignored = LogContext.forConsolidation("corr-1", "0xabc", "ethereum")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("0xabc", MDC.get("address"));
            assertEquals("ethereum", MDC.get("blockchain"));
            assertEquals("consolidate", MDC.get("operation"));
        }

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Nested contexts restore the outer values")
    void nested() {
        try (LogContext outer = LogContext.forConsolidation("corr-1", "0xabc", "ethereum")) {
            try (LogContext inner = LogContext.forSource("victim_reports", "0xdef")) {
                assertEquals("0xdef", MDC.get("address"));
                assertEquals("victim_reports", MDC.get("source"));
                assertEquals("corr-1", MDC.get("correlationId"));
            }
            assertEquals("0xabc", MDC.get("address"));
            assertNull(MDC.get("source"));
        }
        assertNull(MDC.get("address"));
    }

    @Test
    @DisplayName("Batch context records the batch size")
    void batch() {
        try (LogContext ctx = LogContext.forBatch("batch-1", "bitcoin", 12).with("requestId", "req-9")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("12", MDC.get("batchSize"));
            assertEquals("batch", MDC.get("operation"));
            assertEquals("req-9", MDC.get("requestId"));
        }
        assertNull(MDC.get("requestId"));
    }

    @Test
    @DisplayName("Correlation ids are unique")
    void correlationIds() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}

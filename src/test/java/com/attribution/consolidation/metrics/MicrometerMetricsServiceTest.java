package com.attribution.consolidation.metrics;

import com.attribution.consolidation.core.model.ConfidenceLevel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MicrometerMetricsService Tests")
class MicrometerMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsService(registry);
    }

    @Test
    @DisplayName("Consolidation timer is tagged with the confidence level")
    void consolidationTimer() {
        metrics.recordConsolidationDuration(ConfidenceLevel.HIGH, Duration.ofMillis(40));
        metrics.recordConsolidationDuration(ConfidenceLevel.HIGH, Duration.ofMillis(60));
        metrics.recordNoAttribution(Duration.ofMillis(5));

        assertEquals(2, registry.timer("attribution.consolidation.duration", "confidence", "HIGH").count());
        assertEquals(100.0, registry.timer("attribution.consolidation.duration", "confidence", "HIGH")
                .totalTime(TimeUnit.MILLISECONDS), 0.001);
        assertEquals(1, registry.timer("attribution.consolidation.duration", "confidence", "none").count());
    }

    @Test
    @DisplayName("Source meters are tagged per source")
    void sourceMeters() {
        metrics.recordSourceDuration("victim_reports", Duration.ofMillis(10));
        metrics.incrementSourceFailure("victim_reports");
        metrics.incrementSourceFailure("victim_reports");
        metrics.incrementSourceFailure("vasp_registry");

        assertEquals(1, registry.timer("attribution.source.duration", "source", "victim_reports").count());
        assertEquals(2.0, registry.counter("attribution.source.failure", "source", "victim_reports").count());
        assertEquals(1.0, registry.counter("attribution.source.failure", "source", "vasp_registry").count());
    }

    @Test
    @DisplayName("Batch, conflict and cache meters are recorded")
    void otherMeters() {
        metrics.recordBatchSize(25);
        metrics.incrementBatchItemFailure();
        metrics.incrementConflict();
        metrics.recordCacheHit();
        metrics.recordCacheMiss();
        metrics.recordCacheMiss();

        assertEquals(25.0, registry.summary("attribution.batch.size").totalAmount());
        assertEquals(1.0, registry.counter("attribution.batch.item.failure").count());
        assertEquals(1.0, registry.counter("attribution.conflict").count());
        assertEquals(1.0, registry.counter("attribution.cache.hit").count());
        assertEquals(2.0, registry.counter("attribution.cache.miss").count());
    }

    @Test
    @DisplayName("NoOp implementation accepts every call")
    void noOp() {
        NoOpMetricsService noOp = new NoOpMetricsService();
        assertDoesNotThrow(() -> {
            noOp.recordConsolidationDuration(ConfidenceLevel.LOW, Duration.ZERO);
            noOp.recordNoAttribution(Duration.ZERO);
            noOp.recordSourceDuration("x", Duration.ZERO);
            noOp.incrementSourceFailure("x");
            noOp.incrementConflict();
            noOp.recordBatchSize(1);
            noOp.incrementBatchItemFailure();
            noOp.recordCacheHit();
            noOp.recordCacheMiss();
        });
    }
}

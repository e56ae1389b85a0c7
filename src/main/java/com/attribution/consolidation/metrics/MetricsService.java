package com.attribution.consolidation.metrics;

import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.time.Duration;

/**
 * Interface for recording attribution consolidation metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordConsolidationDuration(ConfidenceLevel confidence, Duration duration);

    void recordNoAttribution(Duration duration);

    void recordSourceDuration(String source, Duration duration);

    void incrementSourceFailure(String source);

    void incrementConflict();

    void recordBatchSize(int size);

    void incrementBatchItemFailure();

    void recordCacheHit();

    void recordCacheMiss();
}

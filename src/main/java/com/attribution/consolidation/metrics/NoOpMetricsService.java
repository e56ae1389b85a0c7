package com.attribution.consolidation.metrics;

import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordConsolidationDuration(ConfidenceLevel confidence, Duration duration) {
    }

    @Override
    public void recordNoAttribution(Duration duration) {
    }

    @Override
    public void recordSourceDuration(String source, Duration duration) {
    }

    @Override
    public void incrementSourceFailure(String source) {
    }

    @Override
    public void incrementConflict() {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void incrementBatchItemFailure() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

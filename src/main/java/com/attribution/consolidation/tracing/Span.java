package com.attribution.consolidation.tracing;

import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.util.Set;

/**
 * Trace span of one consolidation or one batch. Ends when closed:
 *
 * <pre>
 * try (Span span = tracingService.startConsolidation(address, "ethereum", correlationId)) {
 *     span.recordSources(attributions.size(), unavailable);
 *     span.recordConsolidation(consolidation);
 * }
 * </pre>
 *
 * Each {@code record*} outcome method also sets the span status.
 */
public interface Span extends AutoCloseable {

    /**
     * What the source fan-out returned.
     */
    void recordSources(int attributionCount, Set<String> unavailableSources);

    void recordConsolidation(AttributionConsolidation consolidation);

    void recordNoAttribution();

    void recordBelowMinConfidence(ConfidenceLevel confidence, ConfidenceLevel minConfidence);

    void recordBatchCompleted(long found, int total);

    void recordBatchCancelled(int completed, int total);

    void recordFailure(Throwable error);

    @Override
    void close();
}

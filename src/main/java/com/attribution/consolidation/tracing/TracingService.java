package com.attribution.consolidation.tracing;

/**
 * Opens the engine's trace spans. {@link NoOpTracingService} is the default, so the engine runs
 * without any tracing backend configured.
 */
public interface TracingService {

    /**
     * Span {@value SpanAttributes#CONSOLIDATE_SPAN} around one address's fan-out and consolidation.
     */
    Span startConsolidation(String address, String blockchain, String correlationId);

    /**
     * Span {@value SpanAttributes#BATCH_SPAN} covering a whole batch, from dispatch to the last item.
     */
    Span startBatch(String batchId, String blockchain, int size, int maxConcurrent);
}

package com.attribution.consolidation.tracing;

/**
 * Hands out a span that drops everything.
 */
public class NoOpTracingService implements TracingService {

    static final Span DISCARDING_SPAN = new DiscardingSpan();

    @Override
    public Span startConsolidation(String address, String blockchain, String correlationId) {
        return DISCARDING_SPAN;
    }

    @Override
    public Span startBatch(String batchId, String blockchain, int size, int maxConcurrent) {
        return DISCARDING_SPAN;
    }

    private static final class DiscardingSpan extends AbstractSpan {
        @Override
        protected void setString(String key, String value) {
        }

        @Override
        protected void setLong(String key, long value) {
        }

        @Override
        protected void setDouble(String key, double value) {
        }

        @Override
        protected void setBoolean(String key, boolean value) {
        }

        @Override
        protected void recordException(Throwable error) {
        }

        @Override
        protected void markOk() {
        }

        @Override
        protected void markError(String description) {
        }

        @Override
        public void close() {
        }
    }
}

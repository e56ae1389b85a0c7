package com.attribution.consolidation.tracing;

import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Objects;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}. Spans are
 * {@link SpanKind#INTERNAL}; keys come from {@link SpanAttributes}.
 */
public class OpenTelemetryTracingService implements TracingService {

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public Span startConsolidation(String address, String blockchain, String correlationId) {
        SpanBuilder builder = spanBuilder(SpanAttributes.CONSOLIDATE_SPAN, blockchain);
        builder.setAttribute(SpanAttributes.ADDRESS, address);
        if (correlationId != null) {
            builder.setAttribute(SpanAttributes.CORRELATION_ID, correlationId);
        }
        return new OTelSpan(builder.startSpan());
    }

    @Override
    public Span startBatch(String batchId, String blockchain, int size, int maxConcurrent) {
        SpanBuilder builder = spanBuilder(SpanAttributes.BATCH_SPAN, blockchain);
        builder.setAttribute(SpanAttributes.BATCH_ID, batchId);
        builder.setAttribute(SpanAttributes.BATCH_SIZE, (long) size);
        builder.setAttribute(SpanAttributes.BATCH_MAX_CONCURRENT, (long) maxConcurrent);
        return new OTelSpan(builder.startSpan());
    }

    private SpanBuilder spanBuilder(String name, String blockchain) {
        SpanBuilder builder = tracer.spanBuilder(name);
        builder.setSpanKind(SpanKind.INTERNAL);
        builder.setAttribute(SpanAttributes.BLOCKCHAIN, blockchain);
        return builder;
    }

    private static final class OTelSpan extends AbstractSpan {

        private final io.opentelemetry.api.trace.Span span;

        OTelSpan(io.opentelemetry.api.trace.Span span) {
            this.span = span;
        }

        @Override
        protected void setString(String key, String value) {
            span.setAttribute(key, value);
        }

        @Override
        protected void setLong(String key, long value) {
            span.setAttribute(key, value);
        }

        @Override
        protected void setDouble(String key, double value) {
            span.setAttribute(key, value);
        }

        @Override
        protected void setBoolean(String key, boolean value) {
            span.setAttribute(key, value);
        }

        @Override
        protected void recordException(Throwable error) {
            span.recordException(error);
        }

        @Override
        protected void markOk() {
            span.setStatus(StatusCode.OK);
        }

        @Override
        protected void markError(String description) {
            span.setStatus(StatusCode.ERROR, description != null ? description : "");
        }

        @Override
        public void close() {
            span.end();
        }
    }
}

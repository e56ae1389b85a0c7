package com.attribution.consolidation.tracing;

import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.util.Set;

/**
 * Maps the engine's span events onto plain attributes and a status.
 * Backends implement the primitive setters.
 */
public abstract class AbstractSpan implements Span {

    @Override
    public void recordSources(int attributionCount, Set<String> unavailableSources) {
        setLong(SpanAttributes.ATTRIBUTION_COUNT, attributionCount);
        if (unavailableSources != null && !unavailableSources.isEmpty()) {
            setString(SpanAttributes.UNAVAILABLE_SOURCES, String.join(",", unavailableSources));
        }
    }

    @Override
    public void recordConsolidation(AttributionConsolidation consolidation) {
        setBoolean(SpanAttributes.FOUND, true);
        if (consolidation.getConsolidatedEntity() != null) {
            setString(SpanAttributes.ENTITY, consolidation.getConsolidatedEntity());
        }
        setString(SpanAttributes.CONFIDENCE, consolidation.getOverallConfidence().wireName());
        setDouble(SpanAttributes.SCORE, consolidation.getConsolidationScore());
        setLong(SpanAttributes.SOURCE_COUNT,
                consolidation.getSupportingSources().size() + consolidation.getConflictingSources().size());
        setBoolean(SpanAttributes.CONFLICTS, consolidation.hasConflicts());
        markOk();
    }

    @Override
    public void recordNoAttribution() {
        setBoolean(SpanAttributes.FOUND, false);
        markOk();
    }

    @Override
    public void recordBelowMinConfidence(ConfidenceLevel confidence, ConfidenceLevel minConfidence) {
        setBoolean(SpanAttributes.FOUND, false);
        setString(SpanAttributes.CONFIDENCE, confidence.wireName());
        setString(SpanAttributes.MIN_CONFIDENCE, minConfidence.wireName());
        markOk();
    }

    @Override
    public void recordBatchCompleted(long found, int total) {
        setLong(SpanAttributes.BATCH_FOUND, found);
        setLong(SpanAttributes.BATCH_COMPLETED, total);
        markOk();
    }

    @Override
    public void recordBatchCancelled(int completed, int total) {
        setBoolean(SpanAttributes.BATCH_CANCELLED, true);
        setLong(SpanAttributes.BATCH_COMPLETED, completed);
        markError("batch cancelled after " + completed + " of " + total + " addresses");
    }

    @Override
    public void recordFailure(Throwable error) {
        recordException(error);
        markError(error.getMessage());
    }

    protected abstract void setString(String key, String value);

    protected abstract void setLong(String key, long value);

    protected abstract void setDouble(String key, double value);

    protected abstract void setBoolean(String key, boolean value);

    protected abstract void recordException(Throwable error);

    protected abstract void markOk();

    protected abstract void markError(String description);
}

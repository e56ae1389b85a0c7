package com.attribution.consolidation.tracing;

/**
 * Span names and attribute keys written by the engine.
 */
public final class SpanAttributes {

    public static final String CONSOLIDATE_SPAN = "attribution.consolidate";
    public static final String BATCH_SPAN = "attribution.batch";

    public static final String ADDRESS = "attribution.address";
    public static final String BLOCKCHAIN = "attribution.blockchain";
    public static final String CORRELATION_ID = "attribution.correlation_id";
    public static final String ATTRIBUTION_COUNT = "attribution.count";
    public static final String UNAVAILABLE_SOURCES = "attribution.sources.unavailable";
    public static final String FOUND = "attribution.found";
    public static final String ENTITY = "attribution.entity";
    public static final String CONFIDENCE = "attribution.confidence";
    public static final String MIN_CONFIDENCE = "attribution.min_confidence";
    public static final String SCORE = "attribution.score";
    public static final String SOURCE_COUNT = "attribution.source_count";
    public static final String CONFLICTS = "attribution.conflicts";

    public static final String BATCH_ID = "attribution.batch.id";
    public static final String BATCH_SIZE = "attribution.batch.size";
    public static final String BATCH_MAX_CONCURRENT = "attribution.batch.max_concurrent";
    public static final String BATCH_FOUND = "attribution.batch.found";
    public static final String BATCH_COMPLETED = "attribution.batch.completed";
    public static final String BATCH_CANCELLED = "attribution.batch.cancelled";

    private SpanAttributes() {
    }
}

package com.attribution.consolidation.metrics;

import com.attribution.consolidation.core.model.ConfidenceLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code attribution.consolidation.duration}: Timer (tag: confidence, {@code none} when nothing was found)</li>
 *   <li>{@code attribution.source.duration}: Timer (tag: source)</li>
 *   <li>{@code attribution.source.failure}: Counter (tag: source)</li>
 *   <li>{@code attribution.conflict}: Counter</li>
 *   <li>{@code attribution.batch.size}: DistributionSummary</li>
 *   <li>{@code attribution.batch.item.failure}: Counter</li>
 *   <li>{@code attribution.cache.hit}: Counter</li>
 *   <li>{@code attribution.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private static final String NO_ATTRIBUTION_TAG = "none";

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final Counter conflictCounter;
    private final Counter batchItemFailureCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("attribution.batch.size")
                .description("Number of addresses per batch consolidation")
                .register(registry);
        this.conflictCounter = Counter.builder("attribution.conflict")
                .description("Consolidations where sources disagree on the entity")
                .register(registry);
        this.batchItemFailureCounter = Counter.builder("attribution.batch.item.failure")
                .description("Batch items that failed and were recorded as null")
                .register(registry);
        this.cacheHitCounter = Counter.builder("attribution.cache.hit")
                .description("Number of consolidation cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("attribution.cache.miss")
                .description("Number of consolidation cache misses")
                .register(registry);
    }

    @Override
    public void recordConsolidationDuration(ConfidenceLevel confidence, Duration duration) {
        consolidationTimer(confidence.name()).record(duration);
    }

    @Override
    public void recordNoAttribution(Duration duration) {
        consolidationTimer(NO_ATTRIBUTION_TAG).record(duration);
    }

    @Override
    public void recordSourceDuration(String source, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("source:" + source, k ->
                Timer.builder("attribution.source.duration")
                        .description("Duration of individual source lookups")
                        .tag("source", source)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementSourceFailure(String source) {
        Counter counter = counterCache.computeIfAbsent("failure:" + source, k ->
                Counter.builder("attribution.source.failure")
                        .description("Source lookups that failed or timed out")
                        .tag("source", source)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementConflict() {
        conflictCounter.increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void incrementBatchItemFailure() {
        batchItemFailureCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Timer consolidationTimer(String confidenceTag) {
        return timerCache.computeIfAbsent("consolidation:" + confidenceTag, k ->
                Timer.builder("attribution.consolidation.duration")
                        .description("Duration of single-address consolidations")
                        .tag("confidence", confidenceTag)
                        .register(registry));
    }
}

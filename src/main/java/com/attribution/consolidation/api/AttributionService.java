package com.attribution.consolidation.api;

import com.attribution.consolidation.cache.CacheConfig;
import com.attribution.consolidation.cache.CacheKey;
import com.attribution.consolidation.cache.CacheStats;
import com.attribution.consolidation.cache.CaffeineConsolidationCache;
import com.attribution.consolidation.cache.ConsolidationCache;
import com.attribution.consolidation.cache.NoOpConsolidationCache;
import com.attribution.consolidation.consensus.AttributionConsolidator;
import com.attribution.consolidation.consensus.ConfidenceClassifier;
import com.attribution.consolidation.consensus.ConflictDetector;
import com.attribution.consolidation.consensus.ConsensusEngine;
import com.attribution.consolidation.consensus.SourceWeights;
import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;
import com.attribution.consolidation.logging.LogContext;
import com.attribution.consolidation.metrics.MetricsService;
import com.attribution.consolidation.metrics.NoOpMetricsService;
import com.attribution.consolidation.persistence.AttributionRepository;
import com.attribution.consolidation.persistence.InMemoryAttributionRepository;
import com.attribution.consolidation.source.OnChainAnalysisAdapter;
import com.attribution.consolidation.source.OnChainAnalysisCollaborator;
import com.attribution.consolidation.source.SourceAdapter;
import com.attribution.consolidation.source.SourceFanOut;
import com.attribution.consolidation.source.SourceResults;
import com.attribution.consolidation.source.ThreatIntelligenceAdapter;
import com.attribution.consolidation.source.ThreatIntelligenceCollaborator;
import com.attribution.consolidation.source.VaspAttributionCollaborator;
import com.attribution.consolidation.source.VaspRegistryAdapter;
import com.attribution.consolidation.source.VictimReportsAdapter;
import com.attribution.consolidation.source.VictimReportsCollaborator;
import com.attribution.consolidation.statistics.AttributionStatistics;
import com.attribution.consolidation.statistics.StatisticsService;
import com.attribution.consolidation.tracing.NoOpTracingService;
import com.attribution.consolidation.tracing.Span;
import com.attribution.consolidation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Main entry point for cross-source attribution consolidation.
 *
 * <p>Usage:</p>
 * <pre>
 * try (AttributionService service = AttributionService.builder()
 *         .victimReports(victimReports)
 *         .threatIntelligence(threatFeeds)
 *         .vaspRegistry(vaspRegistry)
 *         .build()) {
 *     Optional&lt;AttributionConsolidation&gt; result = service.getAttribution("0xabc...", "ethereum");
 * }
 * </pre>
 *
 * <p>Input is validated before any source is contacted and invalid input raises
 * {@link IllegalArgumentException}. Past validation, source failures only reduce the evidence
 * available and never reach the caller.</p>
 */
public class AttributionService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AttributionService.class);

    private static final int DEFAULT_SOURCE_THREADS = 32;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final SourceFanOut fanOut;
    private final AttributionConsolidator consolidator;
    private final ConsolidationCache cache;
    private final AttributionRepository repository;
    private final StatisticsService statisticsService;
    private final BatchOrchestrator batchOrchestrator;
    private final ConsolidationOptions defaultOptions;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService sourceExecutor;
    private final ExecutorService batchExecutor;
    private final boolean ownsExecutors;

    private AttributionService(Builder builder) {
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.defaultOptions = builder.options;
        this.ownsExecutors = builder.sourceExecutor == null;

        this.sourceExecutor = builder.sourceExecutor != null
                ? builder.sourceExecutor
                : Executors.newFixedThreadPool(builder.sourceThreads, daemonThreads("attribution-source"));
        // each batch runs at most maxConcurrent workers on this pool
        this.batchExecutor = Executors.newCachedThreadPool(daemonThreads("attribution-batch"));

        List<SourceAdapter> adapters = new ArrayList<>();
        for (BiFunction<MetricsService, Clock, SourceAdapter> factory : builder.adapterFactories) {
            adapters.add(factory.apply(metricsService, builder.clock));
        }
        this.fanOut = new SourceFanOut(adapters, sourceExecutor, metricsService);

        this.consolidator = new AttributionConsolidator(
                new ConsensusEngine(builder.weights), new ConfidenceClassifier(),
                new ConflictDetector(), builder.clock);

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (builder.cacheConfig.enabled()) {
            this.cache = new CaffeineConsolidationCache(builder.cacheConfig);
        } else {
            this.cache = new NoOpConsolidationCache();
        }

        this.repository = builder.repository != null
                ? builder.repository : new InMemoryAttributionRepository();
        this.statisticsService = new StatisticsService(repository, builder.clock);
        this.batchOrchestrator = new BatchOrchestrator(
                this::consolidateBatchItem, batchExecutor, metricsService, tracingService);

        log.info("AttributionService initialized with sources: {}", fanOut.sourceNames());
    }

    // ========== Single address ==========

    /**
     * Consolidates every source's view of an address using the default options.
     *
     * @return the consolidation, or empty when no source knows the address
     * @throws IllegalArgumentException if the address or blockchain is invalid
     */
    public Optional<AttributionConsolidation> getAttribution(String address, String blockchain) {
        return getAttribution(address, blockchain, defaultOptions);
    }

    /**
     * Consolidates an address with explicit options. The result is empty when no source knows the
     * address, when the overall confidence is below {@code options.getMinConfidence()}, or when
     * consolidation failed unexpectedly.
     *
     * @throws IllegalArgumentException if the address, blockchain or options are invalid
     */
    public Optional<AttributionConsolidation> getAttribution(String address, String blockchain,
                                                             ConsolidationOptions options) {
        ConsolidationOptions opts = options != null ? options : defaultOptions;
        String chain = AttributionRequestValidator.normalizeBlockchain(blockchain);
        String normalized = AttributionRequestValidator.normalizeAddress(address, chain);
        AttributionRequestValidator.validateSources(opts.getSources());

        try {
            return consolidateValidated(normalized, chain, opts);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("attribution.failed address={} blockchain={} error={}",
                    normalized, chain, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Cache-through consolidation of an already validated address.
     */
    private Optional<AttributionConsolidation> consolidateValidated(String address, String blockchain,
                                                                    ConsolidationOptions options) {
        CacheKey key = CacheKey.of(address, blockchain, options.getSources(), options.getMinConfidence());
        Optional<AttributionConsolidation> cached = cache.get(key);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            log.debug("cache.hit key={}", key);
            return cached;
        }
        metricsService.recordCacheMiss();

        String correlationId = LogContext.generateCorrelationId();
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forConsolidation(correlationId, address, blockchain);
             Span span = tracingService.startConsolidation(address, blockchain, correlationId)) {
            try {
                SourceResults sourceResults = fanOut.fetch(
                        address, blockchain, options.getSources(), options.getSourceTimeout());
                List<Attribution> attributions = sourceResults.attributions();
                span.recordSources(attributions.size(), sourceResults.unavailableSources());

                Optional<AttributionConsolidation> result =
                        consolidator.consolidate(address, blockchain, attributions);
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                if (result.isEmpty()) {
                    metricsService.recordNoAttribution(elapsed);
                    log.info("attribution.not_found address={} blockchain={}", address, blockchain);
                    span.recordNoAttribution();
                    return Optional.empty();
                }

                AttributionConsolidation consolidation = result.get();
                metricsService.recordConsolidationDuration(consolidation.getOverallConfidence(), elapsed);
                if (consolidation.hasConflicts()) {
                    metricsService.incrementConflict();
                }
                log.info("attribution.consolidated address={} blockchain={} entity={} confidence={} score={} conflicts={}",
                        address, blockchain, consolidation.getConsolidatedEntity(),
                        consolidation.getOverallConfidence().wireName(),
                        consolidation.getConsolidationScore(), consolidation.hasConflicts());

                ConfidenceLevel minConfidence = options.getMinConfidence();
                if (minConfidence != null && !consolidation.getOverallConfidence().isAtLeast(minConfidence)) {
                    log.debug("attribution.below_min_confidence address={} confidence={} min={}",
                            address, consolidation.getOverallConfidence(), minConfidence);
                    span.recordBelowMinConfidence(consolidation.getOverallConfidence(), minConfidence);
                    return Optional.empty();
                }

                if (sourceResults.isComplete()) {
                    cache.put(key, consolidation);
                } else {
                    log.debug("cache.skipped address={} unavailableSources={}",
                            address, sourceResults.unavailableSources());
                }
                persist(consolidation);
                span.recordConsolidation(consolidation);
                return Optional.of(consolidation);
            } catch (RuntimeException e) {
                span.recordFailure(e);
                throw e;
            }
        }
    }

    private void persist(AttributionConsolidation consolidation) {
        try {
            repository.saveConsolidation(consolidation);
        } catch (RuntimeException e) {
            log.warn("attribution.persist_failed address={} blockchain={} error={}",
                    consolidation.getAddress(), consolidation.getBlockchain(), e.getMessage(), e);
        }
    }

    // ========== Batch ==========

    public Map<String, AttributionConsolidation> consolidateMany(List<String> addresses, String blockchain) {
        return consolidateMany(addresses, blockchain, defaultOptions);
    }

    /**
     * Consolidates a list of addresses with bounded concurrency.
     *
     * @return map keyed by the given address strings, in request order, one entry per distinct
     *         address; {@code null} values where nothing was found or the item failed
     * @throws IllegalArgumentException if any address, the blockchain, or the batch size is invalid
     */
    public Map<String, AttributionConsolidation> consolidateMany(List<String> addresses, String blockchain,
                                                                 ConsolidationOptions options) {
        ConsolidationOptions opts = options != null ? options : defaultOptions;
        String chain = validateBatch(addresses, blockchain, opts);
        return batchOrchestrator.consolidateMany(addresses, chain, opts);
    }

    /**
     * Starts a batch and returns immediately.
     *
     * @param listener notified as each item finishes, or {@code null}
     * @throws IllegalArgumentException if any address, the blockchain, or the batch size is invalid
     */
    public BatchHandle consolidateManyAsync(List<String> addresses, String blockchain,
                                            ConsolidationOptions options, BatchItemListener listener) {
        ConsolidationOptions opts = options != null ? options : defaultOptions;
        String chain = validateBatch(addresses, blockchain, opts);
        return batchOrchestrator.consolidateManyAsync(addresses, chain, opts, listener);
    }

    private String validateBatch(List<String> addresses, String blockchain, ConsolidationOptions options) {
        String chain = AttributionRequestValidator.normalizeBlockchain(blockchain);
        AttributionRequestValidator.validateBatch(addresses, options.getMaxBatchSize());
        AttributionRequestValidator.validateSources(options.getSources());
        return chain;
    }

    /**
     * Batch items arrive in the caller's spelling; each is normalized on its own worker.
     */
    private Optional<AttributionConsolidation> consolidateBatchItem(String address, String blockchain,
                                                                    ConsolidationOptions options) {
        return consolidateValidated(
                AttributionRequestValidator.normalizeAddress(address, blockchain), blockchain, options);
    }

    // ========== Queries ==========

    public List<Attribution> searchByEntity(String entity) {
        return searchByEntity(entity, null, null, AttributionRequestValidator.DEFAULT_SEARCH_LIMIT);
    }

    /**
     * Finds persisted attributions naming an entity, newest first.
     *
     * @param blockchain optional chain filter
     * @param confidence optional exact confidence filter
     * @param limit      1 to 1000
     */
    public List<Attribution> searchByEntity(String entity, String blockchain, ConfidenceLevel confidence, int limit) {
        AttributionRequestValidator.validateEntity(entity);
        AttributionRequestValidator.validateLimit(limit);
        String chain = blockchain != null ? AttributionRequestValidator.normalizeBlockchain(blockchain) : null;
        return repository.findAttributionsByEntity(entity.trim(), chain, confidence, limit);
    }

    /**
     * Aggregates persisted records of the last {@code windowDays} days (1 to 365).
     */
    public AttributionStatistics getStatistics(int windowDays) {
        AttributionRequestValidator.validateWindowDays(windowDays);
        return statisticsService.compute(windowDays);
    }

    /**
     * Persisted consolidations whose sources disagree, newest first.
     *
     * @param blockchain optional chain filter
     */
    public List<AttributionConsolidation> findConflicts(String blockchain) {
        String chain = blockchain != null ? AttributionRequestValidator.normalizeBlockchain(blockchain) : null;
        return repository.findConflictingConsolidations(chain);
    }

    /**
     * Registered source names with their consensus weights, in registration order.
     */
    public Map<String, Double> getSources() {
        Map<String, Double> sources = new LinkedHashMap<>();
        SourceWeights weights = consolidator.getConsensusEngine().getWeights();
        for (String name : fanOut.sourceNames()) {
            sources.put(name, weights.weightOf(name));
        }
        return sources;
    }

    // ========== Cache control ==========

    /**
     * Drops every cached result for an address, whatever filters it was queried with.
     *
     * @return the number of cache entries removed
     */
    public int invalidate(String address, String blockchain) {
        String chain = AttributionRequestValidator.normalizeBlockchain(blockchain);
        String normalized = AttributionRequestValidator.normalizeAddress(address, chain);
        int removed = cache.invalidateAddress(normalized, chain);
        log.info("cache.invalidated address={} blockchain={} entries={}", normalized, chain, removed);
        return removed;
    }

    public void clearCache() {
        cache.clear();
        log.info("cache.cleared");
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public ConsolidationOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public void close() {
        if (ownsExecutors) {
            shutdown(sourceExecutor);
        }
        shutdown(batchExecutor);
        log.info("AttributionService closed");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<BiFunction<MetricsService, Clock, SourceAdapter>> adapterFactories = new ArrayList<>();
        private SourceWeights weights = SourceWeights.defaults();
        private ConsolidationOptions options = ConsolidationOptions.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private ConsolidationCache cache;
        private AttributionRepository repository;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ExecutorService sourceExecutor;
        private int sourceThreads = DEFAULT_SOURCE_THREADS;
        private Clock clock = Clock.systemUTC();

        public Builder victimReports(VictimReportsCollaborator collaborator) {
            adapterFactories.add((metrics, clock) -> new VictimReportsAdapter(collaborator, metrics, clock));
            return this;
        }

        public Builder threatIntelligence(ThreatIntelligenceCollaborator collaborator) {
            adapterFactories.add((metrics, clock) -> new ThreatIntelligenceAdapter(collaborator, metrics, clock));
            return this;
        }

        public Builder vaspRegistry(VaspAttributionCollaborator collaborator) {
            adapterFactories.add((metrics, clock) -> new VaspRegistryAdapter(
                    collaborator, VaspRegistryAdapter.DEFAULT_MIN_CONFIDENCE, metrics, clock));
            return this;
        }

        public Builder onChainAnalysis(OnChainAnalysisCollaborator collaborator) {
            adapterFactories.add((metrics, clock) -> new OnChainAnalysisAdapter(collaborator, metrics, clock));
            return this;
        }

        /**
         * Registers a custom adapter. Its source name must be unique.
         */
        public Builder adapter(SourceAdapter adapter) {
            adapterFactories.add((metrics, clock) -> adapter);
            return this;
        }

        public Builder weights(SourceWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder options(ConsolidationOptions options) {
            this.options = options;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Uses the given cache instead of building one from the cache config.
         */
        public Builder cache(ConsolidationCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder repository(AttributionRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Uses an externally managed executor for source calls. It is not shut down by {@link #close()}.
         */
        public Builder sourceExecutor(ExecutorService sourceExecutor) {
            this.sourceExecutor = sourceExecutor;
            return this;
        }

        public Builder sourceThreads(int sourceThreads) {
            if (sourceThreads <= 0) {
                throw new IllegalArgumentException("sourceThreads must be positive");
            }
            this.sourceThreads = sourceThreads;
            return this;
        }

        /**
         * Clock stamping attributions, consolidations and statistics windows.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public AttributionService build() {
            if (options == null) {
                throw new IllegalStateException("ConsolidationOptions are required");
            }
            if (weights == null) {
                throw new IllegalStateException("SourceWeights are required");
            }
            if (cacheConfig == null) {
                throw new IllegalStateException("CacheConfig is required");
            }
            return new AttributionService(this);
        }
    }
}

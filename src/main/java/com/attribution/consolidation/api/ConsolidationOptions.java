package com.attribution.consolidation.api;

import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Options for consolidation queries: which sources to consult, the minimum confidence
 * to report, and batch and timeout limits.
 */
public class ConsolidationOptions {

    public static final int DEFAULT_MAX_CONCURRENT = 10;
    public static final Duration DEFAULT_SOURCE_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_BATCH_SIZE = 100;

    private final Set<String> sources;
    private final ConfidenceLevel minConfidence;
    private final int maxConcurrent;
    private final Duration sourceTimeout;
    private final int maxBatchSize;

    private ConsolidationOptions(Builder builder) {
        this.sources = Collections.unmodifiableSet(new TreeSet<>(builder.sources));
        this.minConfidence = builder.minConfidence;
        this.maxConcurrent = builder.maxConcurrent;
        this.sourceTimeout = builder.sourceTimeout;
        this.maxBatchSize = builder.maxBatchSize;
    }

    /**
     * Source names to consult, sorted. Empty means every registered source.
     */
    public Set<String> getSources() {
        return sources;
    }

    /**
     * Minimum overall confidence to report, or {@code null} to report everything.
     */
    public ConfidenceLevel getMinConfidence() {
        return minConfidence;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public Duration getSourceTimeout() {
        return sourceTimeout;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    /**
     * Returns a builder pre-filled with these options.
     */
    public Builder toBuilder() {
        return new Builder()
                .sources(sources)
                .minConfidence(minConfidence)
                .maxConcurrent(maxConcurrent)
                .sourceTimeout(sourceTimeout)
                .maxBatchSize(maxBatchSize);
    }

    public static ConsolidationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ConsolidationOptions{sources=" + sources + ", minConfidence=" + minConfidence +
                ", maxConcurrent=" + maxConcurrent + ", sourceTimeout=" + sourceTimeout +
                ", maxBatchSize=" + maxBatchSize + '}';
    }

    public static class Builder {
        private Set<String> sources = new TreeSet<>();
        private ConfidenceLevel minConfidence;
        private int maxConcurrent = DEFAULT_MAX_CONCURRENT;
        private Duration sourceTimeout = DEFAULT_SOURCE_TIMEOUT;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;

        /**
         * Restricts consolidation to the named sources; {@code null} or empty means all.
         */
        public Builder sources(Collection<String> sources) {
            this.sources = sources != null ? new TreeSet<>(sources) : new TreeSet<>();
            return this;
        }

        public Builder minConfidence(ConfidenceLevel minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder maxConcurrent(int maxConcurrent) {
            if (maxConcurrent <= 0) {
                throw new IllegalArgumentException("maxConcurrent must be positive");
            }
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder sourceTimeout(Duration sourceTimeout) {
            if (sourceTimeout == null || sourceTimeout.isNegative() || sourceTimeout.isZero()) {
                throw new IllegalArgumentException("sourceTimeout must be positive");
            }
            this.sourceTimeout = sourceTimeout;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) {
                throw new IllegalArgumentException("maxBatchSize must be positive");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public ConsolidationOptions build() {
            AttributionRequestValidator.validateSources(sources);
            return new ConsolidationOptions(this);
        }
    }
}

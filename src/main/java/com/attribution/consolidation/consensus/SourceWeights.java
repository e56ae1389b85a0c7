package com.attribution.consolidation.consensus;

import com.attribution.consolidation.core.model.SourceNames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reliability multipliers per intelligence source.
 *
 * @param weights       weight per source name
 * @param defaultWeight weight applied to source names not present in {@code weights}
 */
public record SourceWeights(Map<String, Double> weights, double defaultWeight) {

    public static final double UNKNOWN_SOURCE_WEIGHT = 0.5;

    public SourceWeights {
        if (weights == null) {
            throw new IllegalArgumentException("weights must not be null");
        }
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (entry.getValue() == null || entry.getValue() < 0.0) {
                throw new IllegalArgumentException("Weight for source '" + entry.getKey() + "' must be non-negative");
            }
        }
        if (defaultWeight < 0.0) {
            throw new IllegalArgumentException("defaultWeight must be non-negative");
        }
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    /**
     * Default reliability weights. Manual investigation is fully trusted, user reports least.
     */
    public static SourceWeights defaults() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(SourceNames.VICTIM_REPORTS, 0.8);
        weights.put(SourceNames.THREAT_INTELLIGENCE, 0.9);
        weights.put(SourceNames.VASP_REGISTRY, 0.7);
        weights.put(SourceNames.ON_CHAIN_ANALYSIS, 0.6);
        weights.put(SourceNames.USER_REPORTS, 0.5);
        weights.put(SourceNames.EXTERNAL_API, 0.8);
        weights.put(SourceNames.MANUAL_INVESTIGATION, 1.0);
        return new SourceWeights(weights, UNKNOWN_SOURCE_WEIGHT);
    }

    public double weightOf(String sourceName) {
        return weights.getOrDefault(sourceName, defaultWeight);
    }

    /**
     * Returns a copy with the given source weights replaced or added.
     */
    public SourceWeights withOverrides(Map<String, Double> overrides) {
        Map<String, Double> merged = new LinkedHashMap<>(weights);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return new SourceWeights(merged, defaultWeight);
    }
}

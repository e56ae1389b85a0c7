package com.attribution.consolidation.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One source observation backing an {@link Attribution}.
 *
 * @param sourceName    name of the intelligence source, e.g. {@code victim_reports}
 * @param rawConfidence the source's confidence mapped onto [0, 1]
 * @param evidence      opaque evidence artifacts supplied by this source
 * @param observedAt    when the source made the observation
 */
public record SourceContribution(
        String sourceName,
        double rawConfidence,
        List<String> evidence,
        Instant observedAt
) {
    public SourceContribution {
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("sourceName must not be null or blank");
        }
        if (rawConfidence < 0.0 || rawConfidence > 1.0 || Double.isNaN(rawConfidence)) {
            throw new IllegalArgumentException("rawConfidence must be between 0.0 and 1.0, got " + rawConfidence);
        }
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        observedAt = Objects.requireNonNullElseGet(observedAt, Instant::now);
    }

    public static SourceContribution of(String sourceName, double rawConfidence) {
        return new SourceContribution(sourceName, rawConfidence, List.of(), null);
    }
}

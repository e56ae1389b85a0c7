package com.attribution.consolidation.core.model;

import java.util.Locale;

/**
 * Ordinal confidence bucket for an attribution or a consolidation.
 * Declaration order is the total order: {@code VERY_LOW < LOW < ... < DEFINITIVE}.
 */
public enum ConfidenceLevel {
    /**
     * Below 0.30.
     */
    VERY_LOW(0.10, "very_low"),

    LOW(0.30, "low"),

    MEDIUM(0.50, "medium"),

    HIGH(0.70, "high"),

    VERY_HIGH(0.90, "very_high"),

    /**
     * 0.95 and above.
     */
    DEFINITIVE(0.95, "definitive");

    private final double threshold;
    private final String wireName;

    ConfidenceLevel(double threshold, String wireName) {
        this.threshold = threshold;
        this.wireName = wireName;
    }

    /**
     * Lower bound of this bucket. {@link #VERY_LOW} also absorbs everything below its nominal threshold.
     */
    public double threshold() {
        return threshold;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isAtLeast(ConfidenceLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * Maps a score in [0, 1] to a level, evaluated from the top threshold down.
     */
    public static ConfidenceLevel fromScore(double score) {
        if (score >= DEFINITIVE.threshold) {
            return DEFINITIVE;
        } else if (score >= VERY_HIGH.threshold) {
            return VERY_HIGH;
        } else if (score >= HIGH.threshold) {
            return HIGH;
        } else if (score >= MEDIUM.threshold) {
            return MEDIUM;
        } else if (score >= LOW.threshold) {
            return LOW;
        }
        return VERY_LOW;
    }

    /**
     * Parses either the wire name ({@code very_high}) or the constant name ({@code VERY_HIGH}).
     *
     * @throws IllegalArgumentException if the name matches no level
     */
    public static ConfidenceLevel fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Confidence level must not be null or blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ConfidenceLevel level : values()) {
            if (level.wireName.equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown confidence level: '" + name + "'");
    }
}

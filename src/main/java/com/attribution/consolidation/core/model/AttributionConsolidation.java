package com.attribution.consolidation.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Merged verdict across all sources for one address.
 *
 * <p>Exactly one of {@link #getSupportingSources()} and {@link #getConflictingSources()}
 * is non-empty. Instances are immutable; every consolidation run produces a fresh value.</p>
 */
public final class AttributionConsolidation {

    public static final String META_ENTITY_COUNT = "entity_count";
    public static final String META_SOURCE_COUNT = "source_count";
    public static final String META_HAS_CONFLICTS = "has_conflicts";

    private final String address;
    private final String blockchain;
    private final List<Attribution> attributions;
    private final String consolidatedEntity;
    private final String consolidatedEntityType;
    private final ConfidenceLevel overallConfidence;
    private final SortedSet<String> supportingSources;
    private final SortedSet<String> conflictingSources;
    private final List<String> evidence;
    private final double consolidationScore;
    private final Map<String, Object> metadata;
    private final Instant consolidatedAt;

    private AttributionConsolidation(Builder builder) {
        this.address = Objects.requireNonNull(builder.address, "address is required");
        this.blockchain = Objects.requireNonNull(builder.blockchain, "blockchain is required");
        this.overallConfidence = Objects.requireNonNull(builder.overallConfidence, "overallConfidence is required");
        if (builder.attributions == null || builder.attributions.isEmpty()) {
            throw new IllegalArgumentException("A consolidation requires at least one attribution");
        }
        if (builder.consolidationScore < 0.0 || builder.consolidationScore > 1.0) {
            throw new IllegalArgumentException("consolidationScore must be between 0.0 and 1.0");
        }
        this.attributions = List.copyOf(builder.attributions);
        this.consolidatedEntity = builder.consolidatedEntity;
        this.consolidatedEntityType = builder.consolidatedEntityType;
        this.supportingSources = Collections.unmodifiableSortedSet(new TreeSet<>(builder.supportingSources));
        this.conflictingSources = Collections.unmodifiableSortedSet(new TreeSet<>(builder.conflictingSources));
        if (supportingSources.isEmpty() == conflictingSources.isEmpty()) {
            throw new IllegalArgumentException(
                    "Exactly one of supportingSources and conflictingSources must be non-empty");
        }
        this.evidence = builder.evidence != null ? List.copyOf(builder.evidence) : List.of();
        this.consolidationScore = builder.consolidationScore;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.consolidatedAt = builder.consolidatedAt != null ? builder.consolidatedAt : Instant.now();
    }

    public String getAddress() {
        return address;
    }

    public String getBlockchain() {
        return blockchain;
    }

    public List<Attribution> getAttributions() {
        return attributions;
    }

    /**
     * Returns the winning entity, or null if no named entity won.
     */
    public String getConsolidatedEntity() {
        return consolidatedEntity;
    }

    public String getConsolidatedEntityType() {
        return consolidatedEntityType;
    }

    public ConfidenceLevel getOverallConfidence() {
        return overallConfidence;
    }

    public SortedSet<String> getSupportingSources() {
        return supportingSources;
    }

    public SortedSet<String> getConflictingSources() {
        return conflictingSources;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    public double getConsolidationScore() {
        return consolidationScore;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getConsolidatedAt() {
        return consolidatedAt;
    }

    public boolean hasConflicts() {
        return !conflictingSources.isEmpty();
    }

    public boolean hasEntity() {
        return consolidatedEntity != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String address;
        private String blockchain;
        private List<Attribution> attributions;
        private String consolidatedEntity;
        private String consolidatedEntityType;
        private ConfidenceLevel overallConfidence;
        private Set<String> supportingSources = Set.of();
        private Set<String> conflictingSources = Set.of();
        private List<String> evidence;
        private double consolidationScore;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant consolidatedAt;

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder blockchain(String blockchain) {
            this.blockchain = blockchain;
            return this;
        }

        public Builder attributions(List<Attribution> attributions) {
            this.attributions = attributions;
            return this;
        }

        public Builder consolidatedEntity(String consolidatedEntity) {
            this.consolidatedEntity = consolidatedEntity;
            return this;
        }

        public Builder consolidatedEntityType(String consolidatedEntityType) {
            this.consolidatedEntityType = consolidatedEntityType;
            return this;
        }

        public Builder overallConfidence(ConfidenceLevel overallConfidence) {
            this.overallConfidence = overallConfidence;
            return this;
        }

        public Builder supportingSources(Set<String> supportingSources) {
            this.supportingSources = Objects.requireNonNull(supportingSources);
            return this;
        }

        public Builder conflictingSources(Set<String> conflictingSources) {
            this.conflictingSources = Objects.requireNonNull(conflictingSources);
            return this;
        }

        public Builder evidence(List<String> evidence) {
            this.evidence = evidence;
            return this;
        }

        public Builder consolidationScore(double consolidationScore) {
            this.consolidationScore = consolidationScore;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder consolidatedAt(Instant consolidatedAt) {
            this.consolidatedAt = consolidatedAt;
            return this;
        }

        public AttributionConsolidation build() {
            return new AttributionConsolidation(this);
        }
    }

    @Override
    public String toString() {
        return "AttributionConsolidation{" +
                "address='" + address + '\'' +
                ", blockchain='" + blockchain + '\'' +
                ", consolidatedEntity='" + consolidatedEntity + '\'' +
                ", overallConfidence=" + overallConfidence +
                ", consolidationScore=" + consolidationScore +
                ", supportingSources=" + supportingSources +
                ", conflictingSources=" + conflictingSources +
                ", attributions=" + attributions.size() +
                '}';
    }
}

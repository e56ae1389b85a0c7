package com.attribution.consolidation.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * One source's claim about who controls a blockchain address.
 * Immutable; an attribution always carries at least one {@link SourceContribution}.
 */
public final class Attribution {

    /** Grouping key used when an attribution names no entity. */
    public static final String UNKNOWN_ENTITY = "unknown";

    private final String id;
    private final String address;
    private final String blockchain;
    private final String entity;
    private final String entityType;
    private final ConfidenceLevel confidence;
    private final List<SourceContribution> sources;
    private final List<String> evidence;
    private final double riskScore;
    private final List<String> tags;
    private final Map<String, Object> metadata;
    private final Instant createdAt;

    private Attribution(Builder builder) {
        this.address = requireText(builder.address, "address");
        this.blockchain = requireText(builder.blockchain, "blockchain");
        if (builder.sources.isEmpty()) {
            throw new IllegalArgumentException("An attribution requires at least one source contribution");
        }
        if (builder.riskScore < 0.0 || builder.riskScore > 1.0 || Double.isNaN(builder.riskScore)) {
            throw new IllegalArgumentException("riskScore must be between 0.0 and 1.0");
        }
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.entity = builder.entity != null && !builder.entity.isBlank() ? builder.entity : null;
        this.entityType = builder.entityType;
        this.sources = List.copyOf(builder.sources);
        this.confidence = builder.confidence != null
                ? builder.confidence
                : ConfidenceLevel.fromScore(this.sources.get(0).rawConfidence());
        this.evidence = List.copyOf(builder.evidence);
        this.riskScore = builder.riskScore;
        this.tags = List.copyOf(builder.tags);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() {
        return id;
    }

    public String getAddress() {
        return address;
    }

    public String getBlockchain() {
        return blockchain;
    }

    /**
     * Returns the claimed entity, or null when the source could not name one.
     */
    public String getEntity() {
        return entity;
    }

    /**
     * Returns the entity, or {@value #UNKNOWN_ENTITY} when absent.
     */
    public String getEntityKey() {
        return entity != null ? entity : UNKNOWN_ENTITY;
    }

    public String getEntityType() {
        return entityType;
    }

    public ConfidenceLevel getConfidence() {
        return confidence;
    }

    public List<SourceContribution> getSources() {
        return sources;
    }

    /**
     * Returns the distinct source names in contribution order.
     */
    public Set<String> getSourceNames() {
        Set<String> names = new LinkedHashSet<>();
        for (SourceContribution source : sources) {
            names.add(source.sourceName());
        }
        return names;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public List<String> getTags() {
        return tags;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String address;
        private String blockchain;
        private String entity;
        private String entityType;
        private ConfidenceLevel confidence;
        private final List<SourceContribution> sources = new ArrayList<>();
        private final List<String> evidence = new ArrayList<>();
        private double riskScore = 0.0;
        private final List<String> tags = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder blockchain(String blockchain) {
            this.blockchain = blockchain;
            return this;
        }

        public Builder entity(String entity) {
            this.entity = entity;
            return this;
        }

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder confidence(ConfidenceLevel confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder source(SourceContribution source) {
            this.sources.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        public Builder sources(List<SourceContribution> sources) {
            this.sources.clear();
            sources.forEach(this::source);
            return this;
        }

        public Builder evidence(List<String> evidence) {
            this.evidence.clear();
            if (evidence != null) {
                this.evidence.addAll(evidence);
            }
            return this;
        }

        public Builder riskScore(double riskScore) {
            this.riskScore = riskScore;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags.clear();
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                metadata.forEach(this::metadata);
            }
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Attribution build() {
            return new Attribution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Attribution that = (Attribution) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Attribution{" +
                "id='" + id + '\'' +
                ", address='" + address + '\'' +
                ", blockchain='" + blockchain + '\'' +
                ", entity='" + getEntityKey() + '\'' +
                ", entityType='" + entityType + '\'' +
                ", confidence=" + confidence +
                ", sources=" + getSourceNames() +
                '}';
    }
}

package com.attribution.consolidation.persistence;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of AttributionRepository.
 * Thread-safe via ConcurrentHashMap.
 */
public class InMemoryAttributionRepository implements AttributionRepository {

    private final ConcurrentMap<String, AttributionConsolidation> consolidations = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Attribution> attributions = new ConcurrentHashMap<>();

    @Override
    public void saveConsolidation(AttributionConsolidation consolidation) {
        Objects.requireNonNull(consolidation, "consolidation is required");
        consolidations.put(key(consolidation.getAddress(), consolidation.getBlockchain()), consolidation);
        for (Attribution attribution : consolidation.getAttributions()) {
            attributions.put(attribution.getId(), attribution);
        }
    }

    @Override
    public Optional<AttributionConsolidation> findConsolidation(String address, String blockchain) {
        return Optional.ofNullable(consolidations.get(key(address, blockchain)));
    }

    @Override
    public List<Attribution> findAttributionsByEntity(String entity, String blockchain,
                                                      ConfidenceLevel confidence, int limit) {
        return attributions.values().stream()
                .filter(a -> a.getEntity() != null && a.getEntity().equalsIgnoreCase(entity))
                .filter(a -> blockchain == null || blockchain.equals(a.getBlockchain()))
                .filter(a -> confidence == null || confidence == a.getConfidence())
                .sorted(Comparator.comparing(Attribution::getCreatedAt).reversed()
                        .thenComparing(Attribution::getId))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public List<AttributionConsolidation> findConsolidationsByConfidence(ConfidenceLevel level) {
        return consolidations.values().stream()
                .filter(c -> c.getOverallConfidence() == level)
                .sorted(Comparator.comparing(AttributionConsolidation::getConsolidatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<AttributionConsolidation> findConflictingConsolidations(String blockchain) {
        return consolidations.values().stream()
                .filter(AttributionConsolidation::hasConflicts)
                .filter(c -> blockchain == null || blockchain.equals(c.getBlockchain()))
                .sorted(Comparator.comparing(AttributionConsolidation::getConsolidatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<AttributionConsolidation> findConsolidationsSince(Instant since) {
        return consolidations.values().stream()
                .filter(c -> !c.getConsolidatedAt().isBefore(since))
                .sorted(Comparator.comparing(AttributionConsolidation::getConsolidatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<Attribution> findAttributionsSince(Instant since) {
        return attributions.values().stream()
                .filter(a -> !a.getCreatedAt().isBefore(since))
                .sorted(Comparator.comparing(Attribution::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    private static String key(String address, String blockchain) {
        return blockchain + ":" + address;
    }
}

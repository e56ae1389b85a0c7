package com.attribution.consolidation.consensus;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.SourceContribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups attributions by claimed entity and ranks the groups by weighted agreement.
 *
 * <h2>Scoring</h2>
 * <pre>
 *   score(group) = Σ weight(source_i) × rawConfidence_i / Σ weight(source_i)
 * </pre>
 * <p>One term per {@link SourceContribution}, so an attribution that already aggregates
 * several observations contributes several terms.</p>
 *
 * <h2>Ranking</h2>
 * <ol>
 *   <li>higher score</li>
 *   <li>higher total source weight</li>
 *   <li>lexicographically smaller entity key</li>
 * </ol>
 * <p>Attributions are sorted into a canonical order before summation, so the result does not
 * depend on the order in which sources answered. This class is stateless and thread-safe.</p>
 */
public class ConsensusEngine {
    private static final Logger log = LoggerFactory.getLogger(ConsensusEngine.class);

    /**
     * Order-independent ordering of attributions: first source name, entity key and id, then
     * content (raw confidence, evidence, creation time) for records sharing an id.
     */
    public static final Comparator<Attribution> CANONICAL_ORDER = Comparator
            .comparing((Attribution a) -> a.getSources().get(0).sourceName())
            .thenComparing(Attribution::getEntityKey)
            .thenComparing(Attribution::getId)
            .thenComparingDouble((Attribution a) -> a.getSources().get(0).rawConfidence())
            .thenComparing((Attribution a) -> String.join("\n", a.getEvidence()))
            .thenComparing(Attribution::getCreatedAt);

    static final Comparator<EntityGroup> RANKING = Comparator
            .comparingDouble(EntityGroup::score).reversed()
            .thenComparing(Comparator.comparingDouble(EntityGroup::totalWeight).reversed())
            .thenComparing(EntityGroup::entityKey);

    private final SourceWeights weights;

    public ConsensusEngine() {
        this(SourceWeights.defaults());
    }

    public ConsensusEngine(SourceWeights weights) {
        this.weights = weights;
    }

    public SourceWeights getWeights() {
        return weights;
    }

    /**
     * Groups and ranks the given attributions.
     *
     * @param attributions attributions for a single address, in any order
     * @return the ranked groups and the winner
     * @throws IllegalArgumentException if {@code attributions} is empty
     */
    public ConsensusResult evaluate(List<Attribution> attributions) {
        if (attributions == null || attributions.isEmpty()) {
            throw new IllegalArgumentException("Cannot evaluate consensus over zero attributions");
        }

        List<Attribution> ordered = new ArrayList<>(attributions);
        ordered.sort(CANONICAL_ORDER);

        Map<String, List<Attribution>> byEntity = new TreeMap<>();
        for (Attribution attribution : ordered) {
            byEntity.computeIfAbsent(attribution.getEntityKey(), k -> new ArrayList<>()).add(attribution);
        }

        List<EntityGroup> groups = new ArrayList<>(byEntity.size());
        for (Map.Entry<String, List<Attribution>> entry : byEntity.entrySet()) {
            groups.add(score(entry.getKey(), entry.getValue()));
        }
        groups.sort(RANKING);

        EntityGroup winner = groups.get(0);
        log.debug("consensus.evaluated groups={} winner='{}' score={}",
                groups.size(), winner.entityKey(), winner.score());
        return new ConsensusResult(groups, winner);
    }

    /**
     * Computes the weighted confidence of one entity group.
     */
    EntityGroup score(String entityKey, List<Attribution> members) {
        double weightedConfidence = 0.0;
        double totalWeight = 0.0;

        for (Attribution attribution : members) {
            for (SourceContribution source : attribution.getSources()) {
                double weight = weights.weightOf(source.sourceName());
                weightedConfidence += weight * source.rawConfidence();
                totalWeight += weight;
            }
        }

        double score = totalWeight == 0.0 ? 0.0 : weightedConfidence / totalWeight;
        // guard against rounding drift past the bounds
        score = Math.max(0.0, Math.min(1.0, score));
        return new EntityGroup(entityKey, members, score, totalWeight);
    }
}

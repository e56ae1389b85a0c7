package com.attribution.consolidation.consensus;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns the attributions gathered for one address into an {@link AttributionConsolidation}.
 * Composes the {@link ConsensusEngine}, {@link ConfidenceClassifier} and {@link ConflictDetector}.
 */
public class AttributionConsolidator {

    private final ConsensusEngine consensusEngine;
    private final ConfidenceClassifier classifier;
    private final ConflictDetector conflictDetector;
    private final Clock clock;

    public AttributionConsolidator(SourceWeights weights) {
        this(new ConsensusEngine(weights), new ConfidenceClassifier(), new ConflictDetector(), Clock.systemUTC());
    }

    public AttributionConsolidator(ConsensusEngine consensusEngine, ConfidenceClassifier classifier,
                                   ConflictDetector conflictDetector, Clock clock) {
        this.consensusEngine = consensusEngine;
        this.classifier = classifier;
        this.conflictDetector = conflictDetector;
        this.clock = clock;
    }

    /**
     * Consolidates the attributions for one address.
     *
     * @return the consolidation, or empty when there is nothing to consolidate
     */
    public Optional<AttributionConsolidation> consolidate(String address, String blockchain,
                                                          List<Attribution> attributions) {
        if (attributions == null || attributions.isEmpty()) {
            return Optional.empty();
        }

        List<Attribution> ordered = new ArrayList<>(attributions);
        ordered.sort(ConsensusEngine.CANONICAL_ORDER);

        ConsensusResult consensus = consensusEngine.evaluate(ordered);
        ConflictAssessment conflicts = conflictDetector.assess(consensus);

        Set<String> allSources = new TreeSet<>();
        List<String> evidence = new ArrayList<>();
        for (Attribution attribution : ordered) {
            allSources.addAll(attribution.getSourceNames());
            evidence.addAll(attribution.getEvidence());
        }

        ConfidenceLevel overall = classifier.classify(consensus.score(), allSources.size(), evidence.size());
        String entity = consensus.winningEntity();

        return Optional.of(AttributionConsolidation.builder()
                .address(address)
                .blockchain(blockchain)
                .attributions(ordered)
                .consolidatedEntity(entity)
                .consolidatedEntityType(entity != null ? consensus.winner().entityType() : null)
                .overallConfidence(overall)
                .supportingSources(conflicts.supportingSources())
                .conflictingSources(conflicts.conflictingSources())
                .evidence(evidence)
                .consolidationScore(consensus.score())
                .metadata(AttributionConsolidation.META_ENTITY_COUNT, consensus.entityCount())
                .metadata(AttributionConsolidation.META_SOURCE_COUNT, allSources.size())
                .metadata(AttributionConsolidation.META_HAS_CONFLICTS, conflicts.hasConflicts())
                .consolidatedAt(clock.instant())
                .build());
    }

    public ConsensusEngine getConsensusEngine() {
        return consensusEngine;
    }
}

package com.attribution.consolidation.consensus;

import java.util.List;

/**
 * Outcome of grouping and scoring one address's attributions.
 *
 * @param groups  every non-empty entity group, best first
 * @param winner  the highest-ranked group
 */
public record ConsensusResult(List<EntityGroup> groups, EntityGroup winner) {

    public ConsensusResult {
        groups = List.copyOf(groups);
        if (groups.isEmpty() || winner == null) {
            throw new IllegalArgumentException("A consensus result requires at least one group");
        }
    }

    /**
     * Winning entity name, or null when the winning group is the unknown group.
     */
    public String winningEntity() {
        return winner.isUnknown() ? null : winner.entityKey();
    }

    public double score() {
        return winner.score();
    }

    public int entityCount() {
        return groups.size();
    }
}

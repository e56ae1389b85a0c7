package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;

import java.util.List;

/**
 * Heuristic attribution from on-chain behaviour (clustering, timing, amount patterns).
 */
@FunctionalInterface
public interface OnChainAnalysisCollaborator {

    /**
     * Placeholder until on-chain heuristics are available: finds nothing.
     */
    OnChainAnalysisCollaborator NONE = (address, blockchain) -> List.of();

    List<Attribution> analyze(String address, String blockchain);
}

package com.attribution.consolidation.consensus;

import java.util.Set;
import java.util.TreeSet;

/**
 * Flags identity disagreement between sources.
 *
 * <p>Any second entity group marks every contributing source as conflicting, whatever the
 * confidence gap between the groups. A lone low-confidence dissenter is reported the same
 * way as an even split.</p>
 */
public class ConflictDetector {

    public ConflictAssessment assess(ConsensusResult consensus) {
        Set<String> allSources = new TreeSet<>();
        for (EntityGroup group : consensus.groups()) {
            allSources.addAll(group.sourceNames());
        }

        if (consensus.groups().size() > 1) {
            return ConflictAssessment.conflicting(allSources);
        }
        return ConflictAssessment.supporting(allSources);
    }
}

package com.attribution.consolidation.source;

import java.util.List;

/**
 * Search access to aggregated threat intelligence feeds.
 */
public interface ThreatIntelligenceCollaborator {

    /**
     * Returns indicators matching any of the given addresses.
     */
    List<ThreatIntelItem> search(List<String> addresses);
}

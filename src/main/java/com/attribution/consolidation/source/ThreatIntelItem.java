package com.attribution.consolidation.source;

import java.time.Instant;
import java.util.List;

/**
 * One indicator from a threat intelligence feed.
 *
 * @param id              indicator identifier
 * @param address         flagged address
 * @param entity          attributed threat actor, if any
 * @param threatType      e.g. phishing, ransomware, sanctions
 * @param threatLevel     severe, critical, high, medium or low
 * @param confidenceScore the feed's own confidence in [0, 1]
 * @param feedSource      name of the originating feed
 * @param evidence        evidence references
 * @param firstSeen       first sighting
 * @param lastSeen        most recent sighting
 */
public record ThreatIntelItem(
        String id,
        String address,
        String entity,
        String threatType,
        String threatLevel,
        double confidenceScore,
        String feedSource,
        List<String> evidence,
        Instant firstSeen,
        Instant lastSeen
) {
    public ThreatIntelItem {
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }
}

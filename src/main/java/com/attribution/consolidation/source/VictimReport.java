package com.attribution.consolidation.source;

import java.time.Instant;
import java.util.List;

/**
 * A scam report filed by a victim, as returned by the victim reports subsystem.
 *
 * @param reportId       report identifier
 * @param scammerAddress address the victim reported as the scammer's
 * @param entity         named scam entity, if the victim knew one
 * @param severity       severe, critical, high, medium or low
 * @param status         verified, investigating, pending, false_positive or resolved
 * @param evidence       evidence references attached to the report
 * @param amountLost     reported loss in USD, or null
 * @param reportedAt     filing time
 */
public record VictimReport(
        String reportId,
        String scammerAddress,
        String entity,
        String severity,
        String status,
        List<String> evidence,
        Double amountLost,
        Instant reportedAt
) {
    public VictimReport {
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }
}

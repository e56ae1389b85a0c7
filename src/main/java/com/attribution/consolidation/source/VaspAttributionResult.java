package com.attribution.consolidation.source;

import java.util.List;

/**
 * Registry match linking an address to a registered virtual asset service provider.
 *
 * @param attributionId      registry attribution identifier
 * @param vaspId             VASP identifier, used as the entity name
 * @param entityType         e.g. exchange, custodian, mixer
 * @param confidenceScore    registry confidence in [0, 1]
 * @param verificationStatus pending, verified, disputed or rejected
 * @param evidence           evidence references
 * @param riskScore          registry risk in [0, 1]
 */
public record VaspAttributionResult(
        String attributionId,
        String vaspId,
        String entityType,
        double confidenceScore,
        String verificationStatus,
        List<String> evidence,
        double riskScore
) {
    public VaspAttributionResult {
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
    }
}

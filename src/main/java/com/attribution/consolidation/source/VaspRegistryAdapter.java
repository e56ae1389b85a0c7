package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.SourceContribution;
import com.attribution.consolidation.core.model.SourceNames;
import com.attribution.consolidation.metrics.MetricsService;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Maps VASP registry matches to attributions naming the VASP.
 * The registry's confidence score is already on the shared [0, 1] scale.
 */
public class VaspRegistryAdapter extends AbstractSourceAdapter {

    /** Registry matches below this confidence are not requested. */
    public static final double DEFAULT_MIN_CONFIDENCE = 0.3;

    private final VaspAttributionCollaborator collaborator;
    private final double minConfidence;

    public VaspRegistryAdapter(VaspAttributionCollaborator collaborator) {
        this(collaborator, DEFAULT_MIN_CONFIDENCE, null);
    }

    public VaspRegistryAdapter(VaspAttributionCollaborator collaborator, double minConfidence,
                               MetricsService metricsService) {
        this(collaborator, minConfidence, metricsService, null);
    }

    public VaspRegistryAdapter(VaspAttributionCollaborator collaborator, double minConfidence,
                               MetricsService metricsService, Clock clock) {
        super(SourceNames.VASP_REGISTRY, metricsService, clock);
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence must be between 0.0 and 1.0");
        }
        this.collaborator = Objects.requireNonNull(collaborator, "collaborator is required");
        this.minConfidence = minConfidence;
    }

    @Override
    protected List<Attribution> doFetch(String address, String blockchain) {
        return mapEach(address, collaborator.attribute(address, blockchain, minConfidence)
                .map(List::of)
                .orElse(List.of()), result -> toAttribution(address, blockchain, result));
    }

    private Attribution toAttribution(String address, String blockchain, VaspAttributionResult result) {
        double rawConfidence = clamp(result.confidenceScore());
        return Attribution.builder()
                .id(attributionId(address, result.attributionId(), result.vaspId(), result.entityType(),
                        rawConfidence, result.evidence()))
                .address(address)
                .blockchain(blockchain)
                .entity(result.vaspId())
                .entityType(result.entityType() != null ? result.entityType() : "unknown")
                .source(new SourceContribution(sourceName(), rawConfidence, result.evidence(), now()))
                .evidence(result.evidence())
                .riskScore(clamp(result.riskScore()))
                .tags(List.of("vasp_registry", "exchange", "financial"))
                .metadata("attribution_id", result.attributionId())
                .metadata("verification_status", result.verificationStatus())
                .createdAt(now())
                .build();
    }
}

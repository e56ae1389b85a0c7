package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.SourceContribution;
import com.attribution.consolidation.core.model.SourceNames;
import com.attribution.consolidation.metrics.MetricsService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps threat feed indicators to {@code threat_actor} attributions.
 * Raw confidence is the threat-level base scaled by the feed's own confidence score.
 */
public class ThreatIntelligenceAdapter extends AbstractSourceAdapter {

    static final Map<String, Double> LEVEL_CONFIDENCE = Map.of(
            "severe", 0.9,
            "critical", 0.85,
            "high", 0.8,
            "medium", 0.6,
            "low", 0.4
    );
    private static final double DEFAULT_LEVEL_CONFIDENCE = 0.5;

    private final ThreatIntelligenceCollaborator collaborator;

    public ThreatIntelligenceAdapter(ThreatIntelligenceCollaborator collaborator) {
        this(collaborator, null);
    }

    public ThreatIntelligenceAdapter(ThreatIntelligenceCollaborator collaborator, MetricsService metricsService) {
        this(collaborator, metricsService, null);
    }

    public ThreatIntelligenceAdapter(ThreatIntelligenceCollaborator collaborator, MetricsService metricsService,
                                     Clock clock) {
        super(SourceNames.THREAT_INTELLIGENCE, metricsService, clock);
        this.collaborator = Objects.requireNonNull(collaborator, "collaborator is required");
    }

    @Override
    protected List<Attribution> doFetch(String address, String blockchain) {
        return mapEach(address, collaborator.search(List.of(address)), item -> {
            if (item.address() == null || !item.address().equalsIgnoreCase(address)) {
                return null;
            }
            return toAttribution(address, blockchain, item);
        });
    }

    private Attribution toAttribution(String address, String blockchain, ThreatIntelItem item) {
        double rawConfidence = rawConfidence(item.threatLevel(), item.confidenceScore());
        List<String> tags = new ArrayList<>();
        tags.add("threat_intelligence");
        if (item.threatType() != null) {
            tags.add(item.threatType());
        }
        return Attribution.builder()
                .id(attributionId(address, item.id(), item.entity(), item.threatType(), item.threatLevel(),
                        rawConfidence, item.evidence(), item.firstSeen(), item.lastSeen()))
                .address(address)
                .blockchain(blockchain)
                .entity(item.entity())
                .entityType("threat_actor")
                .source(new SourceContribution(sourceName(), rawConfidence,
                        item.evidence(), orNow(item.lastSeen())))
                .evidence(item.evidence())
                .riskScore(SEVERITY_RISK.getOrDefault(lower(item.threatLevel()), DEFAULT_SEVERITY_RISK))
                .tags(tags)
                .metadata("feed_source", item.feedSource())
                .metadata("threat_type", item.threatType())
                .metadata("threat_level", item.threatLevel())
                .metadata("first_seen", item.firstSeen() != null ? item.firstSeen().toString() : null)
                .metadata("last_seen", item.lastSeen() != null ? item.lastSeen().toString() : null)
                .createdAt(now())
                .build();
    }

    static double rawConfidence(String threatLevel, double feedConfidence) {
        double base = LEVEL_CONFIDENCE.getOrDefault(lower(threatLevel), DEFAULT_LEVEL_CONFIDENCE);
        return clamp(base * feedConfidence);
    }
}

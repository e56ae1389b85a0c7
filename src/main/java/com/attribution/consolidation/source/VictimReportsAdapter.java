package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.SourceContribution;
import com.attribution.consolidation.core.model.SourceNames;
import com.attribution.consolidation.metrics.MetricsService;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps victim scam reports to {@code scammer} attributions.
 *
 * <p>Raw confidence is driven by the report's investigation status and nudged by severity:</p>
 * <pre>
 *   status:   verified 0.9, resolved 0.8, investigating 0.6, pending 0.3, false_positive 0.1, other 0.5
 *   severity: severe +0.10, critical +0.05, high 0, medium -0.05, low -0.10
 * </pre>
 */
public class VictimReportsAdapter extends AbstractSourceAdapter {

    static final Map<String, Double> STATUS_CONFIDENCE = Map.of(
            "verified", 0.9,
            "investigating", 0.6,
            "pending", 0.3,
            "false_positive", 0.1,
            "resolved", 0.8
    );
    static final Map<String, Double> SEVERITY_ADJUSTMENT = Map.of(
            "severe", 0.1,
            "critical", 0.05,
            "high", 0.0,
            "medium", -0.05,
            "low", -0.1
    );
    private static final double DEFAULT_STATUS_CONFIDENCE = 0.5;
    private static final double LOSS_NORMALIZATION_USD = 100_000.0;
    private static final double MAX_LOSS_RISK = 0.9;

    private final VictimReportsCollaborator collaborator;

    public VictimReportsAdapter(VictimReportsCollaborator collaborator) {
        this(collaborator, null);
    }

    public VictimReportsAdapter(VictimReportsCollaborator collaborator, MetricsService metricsService) {
        this(collaborator, metricsService, null);
    }

    public VictimReportsAdapter(VictimReportsCollaborator collaborator, MetricsService metricsService, Clock clock) {
        super(SourceNames.VICTIM_REPORTS, metricsService, clock);
        this.collaborator = Objects.requireNonNull(collaborator, "collaborator is required");
    }

    @Override
    protected List<Attribution> doFetch(String address, String blockchain) {
        return mapEach(address, collaborator.searchByAddress(address), report -> {
            if (report.scammerAddress() == null || !report.scammerAddress().equalsIgnoreCase(address)) {
                return null;
            }
            return toAttribution(address, blockchain, report);
        });
    }

    private Attribution toAttribution(String address, String blockchain, VictimReport report) {
        double rawConfidence = rawConfidence(report.status(), report.severity());
        return Attribution.builder()
                .id(attributionId(address, report.reportId(), report.entity(), report.status(),
                        report.severity(), report.evidence(), report.amountLost(), report.reportedAt()))
                .address(address)
                .blockchain(blockchain)
                .entity(report.entity())
                .entityType("scammer")
                .source(new SourceContribution(sourceName(), rawConfidence, report.evidence(),
                        orNow(report.reportedAt())))
                .evidence(report.evidence())
                .riskScore(riskScore(report.severity(), report.amountLost()))
                .tags(List.of("victim_report", "scam", "fraud"))
                .metadata("report_id", report.reportId())
                .metadata("severity", report.severity())
                .metadata("status", report.status())
                .metadata("amount_lost", report.amountLost())
                .metadata("reported_at", report.reportedAt() != null ? report.reportedAt().toString() : null)
                .createdAt(now())
                .build();
    }

    static double rawConfidence(String status, String severity) {
        double base = STATUS_CONFIDENCE.getOrDefault(lower(status), DEFAULT_STATUS_CONFIDENCE);
        double adjustment = SEVERITY_ADJUSTMENT.getOrDefault(lower(severity), 0.0);
        return clamp(base + adjustment);
    }

    /**
     * Severity risk, averaged with a loss component (capped at 0.9, $100k scale) when a loss is known.
     */
    static double riskScore(String severity, Double amountLost) {
        double severityRisk = SEVERITY_RISK.getOrDefault(lower(severity), DEFAULT_SEVERITY_RISK);
        if (amountLost != null && amountLost > 0 && !amountLost.isInfinite()) {
            double amountRisk = Math.min(MAX_LOSS_RISK, amountLost / LOSS_NORMALIZATION_USD);
            return clamp((severityRisk + amountRisk) / 2);
        }
        return severityRisk;
    }
}

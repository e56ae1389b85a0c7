package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.SourceNames;
import com.attribution.consolidation.metrics.MetricsService;

import java.time.Clock;
import java.util.List;

/**
 * Passes through attributions from on-chain heuristics.
 * Defaults to {@link OnChainAnalysisCollaborator#NONE}.
 */
public class OnChainAnalysisAdapter extends AbstractSourceAdapter {

    private final OnChainAnalysisCollaborator collaborator;

    public OnChainAnalysisAdapter() {
        this(OnChainAnalysisCollaborator.NONE, null);
    }

    public OnChainAnalysisAdapter(OnChainAnalysisCollaborator collaborator, MetricsService metricsService) {
        this(collaborator, metricsService, null);
    }

    public OnChainAnalysisAdapter(OnChainAnalysisCollaborator collaborator, MetricsService metricsService,
                                  Clock clock) {
        super(SourceNames.ON_CHAIN_ANALYSIS, metricsService, clock);
        this.collaborator = collaborator != null ? collaborator : OnChainAnalysisCollaborator.NONE;
    }

    @Override
    protected List<Attribution> doFetch(String address, String blockchain) {
        return collaborator.analyze(address, blockchain);
    }
}

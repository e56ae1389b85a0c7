package com.attribution.consolidation.statistics;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;
import com.attribution.consolidation.persistence.AttributionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Computes {@link AttributionStatistics} from the records held by an {@link AttributionRepository}.
 */
public class StatisticsService {
    private static final Logger log = LoggerFactory.getLogger(StatisticsService.class);

    private final AttributionRepository repository;
    private final Clock clock;

    public StatisticsService(AttributionRepository repository) {
        this(repository, Clock.systemUTC());
    }

    public StatisticsService(AttributionRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Aggregates the records of the last {@code windowDays} days.
     * The caller validates the window bounds.
     */
    public AttributionStatistics compute(int windowDays) {
        Instant now = clock.instant();
        Instant since = now.minus(Duration.ofDays(windowDays));

        List<Attribution> attributions = repository.findAttributionsSince(since);
        Set<String> addresses = new HashSet<>();
        Set<String> entities = new HashSet<>();
        Set<String> blockchains = new HashSet<>();
        Map<ConfidenceLevel, Long> byConfidence = new EnumMap<>(ConfidenceLevel.class);
        Map<String, Long> bySource = new TreeMap<>();
        double riskTotal = 0.0;

        for (Attribution attribution : attributions) {
            addresses.add(attribution.getBlockchain() + ":" + attribution.getAddress());
            if (attribution.getEntity() != null) {
                entities.add(attribution.getEntity());
            }
            blockchains.add(attribution.getBlockchain());
            byConfidence.merge(attribution.getConfidence(), 1L, Long::sum);
            for (String source : attribution.getSourceNames()) {
                bySource.merge(source, 1L, Long::sum);
            }
            riskTotal += attribution.getRiskScore();
        }

        List<AttributionConsolidation> consolidations = repository.findConsolidationsSince(since);
        long withConflicts = 0;
        long withSupport = 0;
        double scoreTotal = 0.0;
        for (AttributionConsolidation consolidation : consolidations) {
            if (consolidation.hasConflicts()) {
                withConflicts++;
            } else {
                withSupport++;
            }
            scoreTotal += consolidation.getConsolidationScore();
        }

        AttributionStatistics statistics = new AttributionStatistics(
                windowDays,
                attributions.size(),
                addresses.size(),
                entities.size(),
                blockchains.size(),
                attributions.isEmpty() ? 0.0 : riskTotal / attributions.size(),
                consolidations.size(),
                consolidations.isEmpty() ? 0.0 : scoreTotal / consolidations.size(),
                withConflicts,
                withSupport,
                byConfidence,
                bySource,
                now
        );
        log.debug("statistics.computed windowDays={} attributions={} consolidations={}",
                windowDays, attributions.size(), consolidations.size());
        return statistics;
    }
}

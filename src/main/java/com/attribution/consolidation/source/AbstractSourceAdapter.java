package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.logging.LogContext;
import com.attribution.consolidation.metrics.MetricsService;
import com.attribution.consolidation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;

/**
 * Base class enforcing the best-effort contract of {@link SourceAdapter}.
 * Subclasses implement {@link #doFetch}; any exception it throws is logged,
 * counted, and turned into an empty result. Records mapped through {@link #mapEach}
 * fail one at a time: a malformed record is skipped and the rest are kept.
 */
public abstract class AbstractSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(AbstractSourceAdapter.class);

    /** Risk by severity or threat level, shared by the report-style sources. */
    protected static final Map<String, Double> SEVERITY_RISK = Map.of(
            "severe", 0.9,
            "critical", 0.95,
            "high", 0.8,
            "medium", 0.6,
            "low", 0.4
    );
    protected static final double DEFAULT_SEVERITY_RISK = 0.5;

    private final String sourceName;
    private final MetricsService metricsService;
    private final Clock clock;

    protected AbstractSourceAdapter(String sourceName, MetricsService metricsService) {
        this(sourceName, metricsService, null);
    }

    protected AbstractSourceAdapter(String sourceName, MetricsService metricsService, Clock clock) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    @Override
    public final String sourceName() {
        return sourceName;
    }

    @Override
    public final List<Attribution> fetch(String address, String blockchain) {
        try (LogContext ignored = LogContext.forSource(sourceName, address)) {
            List<Attribution> attributions = doFetch(address, blockchain);
            return attributions != null ? List.copyOf(attributions) : List.of();
        } catch (RuntimeException e) {
            log.warn("source.failed source={} address={} blockchain={} error={}",
                    sourceName, address, blockchain, e.getMessage(), e);
            metricsService.incrementSourceFailure(sourceName);
            return List.of();
        }
    }

    /**
     * Queries the collaborator and maps its records. May throw; the caller recovers.
     */
    protected abstract List<Attribution> doFetch(String address, String blockchain);

    /**
     * Maps collaborator records one by one. A mapper returning {@code null} filters the record out;
     * a mapper throwing skips only that record.
     */
    protected <T> List<Attribution> mapEach(String address, Collection<T> records, Function<T, Attribution> mapper) {
        Objects.requireNonNull(records, "collaborator returned no record list");
        List<Attribution> attributions = new ArrayList<>();
        for (T item : records) {
            if (item == null) {
                continue;
            }
            try {
                Attribution attribution = mapper.apply(item);
                if (attribution != null) {
                    attributions.add(attribution);
                }
            } catch (RuntimeException e) {
                log.warn("source.record_skipped source={} address={} error={}",
                        sourceName, address, e.getMessage());
            }
        }
        return attributions;
    }

    /**
     * Stable attribution id for a native record, so re-fetching the same record yields the same id.
     * Records without a native id are identified by their content instead.
     *
     * @param content the record's identifying fields, used only when {@code nativeId} is null
     */
    protected String attributionId(String address, String nativeId, Object... content) {
        StringBuilder seed = new StringBuilder(sourceName).append(':').append(address).append(':');
        if (nativeId != null) {
            seed.append(nativeId);
        } else {
            seed.append("content");
            for (Object part : content) {
                seed.append('|').append(part);
            }
        }
        return UUID.nameUUIDFromBytes(seed.toString().getBytes(StandardCharsets.UTF_8)).toString();
    }

    /**
     * Current time on the adapter's clock, for records the collaborator did not timestamp.
     */
    protected Instant now() {
        return clock.instant();
    }

    protected Instant orNow(Instant observedAt) {
        return observedAt != null ? observedAt : now();
    }

    /**
     * Clamps to [0, 1]. NaN maps to 0.
     */
    protected static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    protected static String lower(String value) {
        return value != null ? value.toLowerCase(Locale.ROOT) : "";
    }
}

package com.attribution.consolidation.cdi;

import com.attribution.consolidation.api.AttributionService;
import com.attribution.consolidation.api.ConsolidationOptions;
import com.attribution.consolidation.cache.CacheConfig;
import com.attribution.consolidation.consensus.SourceWeights;
import com.attribution.consolidation.core.model.SourceNames;
import com.attribution.consolidation.metrics.MicrometerMetricsService;
import com.attribution.consolidation.source.OnChainAnalysisCollaborator;
import com.attribution.consolidation.source.ThreatIntelligenceCollaborator;
import com.attribution.consolidation.source.VaspAttributionCollaborator;
import com.attribution.consolidation.source.VictimReportsCollaborator;
import com.attribution.consolidation.tracing.OpenTelemetryTracingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CDI producer that wires an {@link AttributionService} from MicroProfile Config properties
 * and whatever collaborator beans the container provides.
 *
 * <p>A source is enabled when a bean implementing its collaborator interface is resolvable.
 * A {@link MeterRegistry} bean switches on Micrometer metrics and a {@link Tracer} bean
 * switches on OpenTelemetry tracing.</p>
 *
 * <pre>
 * attribution:
 *   cache:
 *     enabled: true
 *     max-size: 10000
 *     ttl-seconds: 1800
 *   batch:
 *     max-concurrent: 10
 *     max-size: 100
 *   source:
 *     timeout-seconds: 10
 *     threads: 32
 *     enabled: victim_reports,threat_intelligence
 *   weights:
 *     threat-intelligence: 0.9
 * </pre>
 */
@ApplicationScoped
public class AttributionProducer {

    private static final Logger log = LoggerFactory.getLogger(AttributionProducer.class);

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "attribution.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "attribution.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "attribution.cache.ttl-seconds", defaultValue = "1800")
    int cacheTtlSeconds;

    // ── Batch ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "attribution.batch.max-concurrent", defaultValue = "10")
    int batchMaxConcurrent;

    @Inject
    @ConfigProperty(name = "attribution.batch.max-size", defaultValue = "100")
    int batchMaxSize;

    // ── Sources ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "attribution.source.timeout-seconds", defaultValue = "10")
    long sourceTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "attribution.source.threads", defaultValue = "32")
    int sourceThreads;

    @Inject
    @ConfigProperty(name = "attribution.source.enabled")
    Optional<List<String>> enabledSources;

    // ── Weights ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "attribution.weights.victim-reports", defaultValue = "0.8")
    double victimReportsWeight;

    @Inject
    @ConfigProperty(name = "attribution.weights.threat-intelligence", defaultValue = "0.9")
    double threatIntelligenceWeight;

    @Inject
    @ConfigProperty(name = "attribution.weights.vasp-registry", defaultValue = "0.7")
    double vaspRegistryWeight;

    @Inject
    @ConfigProperty(name = "attribution.weights.on-chain-analysis", defaultValue = "0.6")
    double onChainAnalysisWeight;

    // ── Collaborators ─────────────────────────────────────────

    @Inject
    Instance<VictimReportsCollaborator> victimReports;

    @Inject
    Instance<ThreatIntelligenceCollaborator> threatIntelligence;

    @Inject
    Instance<VaspAttributionCollaborator> vaspRegistry;

    @Inject
    Instance<OnChainAnalysisCollaborator> onChainAnalysis;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    @Inject
    Instance<Tracer> tracer;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public AttributionService attributionService() {
        ConsolidationOptions.Builder options = ConsolidationOptions.builder()
                .maxConcurrent(batchMaxConcurrent)
                .maxBatchSize(batchMaxSize)
                .sourceTimeout(Duration.ofSeconds(sourceTimeoutSeconds));

        AttributionService.Builder builder = AttributionService.builder()
                .options(options.build())
                .weights(sourceWeights())
                .cacheConfig(cacheEnabled
                        ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                        : CacheConfig.disabled())
                .sourceThreads(sourceThreads);

        if (isEnabled(SourceNames.VICTIM_REPORTS) && victimReports.isResolvable()) {
            builder.victimReports(victimReports.get());
        }
        if (isEnabled(SourceNames.THREAT_INTELLIGENCE) && threatIntelligence.isResolvable()) {
            builder.threatIntelligence(threatIntelligence.get());
        }
        if (isEnabled(SourceNames.VASP_REGISTRY) && vaspRegistry.isResolvable()) {
            builder.vaspRegistry(vaspRegistry.get());
        }
        if (isEnabled(SourceNames.ON_CHAIN_ANALYSIS)) {
            builder.onChainAnalysis(onChainAnalysis.isResolvable()
                    ? onChainAnalysis.get() : OnChainAnalysisCollaborator.NONE);
        }

        if (meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
            log.info("Micrometer metrics enabled");
        }
        if (tracer.isResolvable()) {
            builder.tracingService(new OpenTelemetryTracingService(tracer.get()));
            log.info("OpenTelemetry tracing enabled");
        }

        log.info("Producing AttributionService: cache={} maxSize={} ttl={}s maxConcurrent={} sourceTimeout={}s",
                cacheEnabled, cacheMaxSize, cacheTtlSeconds, batchMaxConcurrent, sourceTimeoutSeconds);
        return builder.build();
    }

    public void closeService(@Disposes AttributionService service) {
        log.info("Closing AttributionService");
        service.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    SourceWeights sourceWeights() {
        Map<String, Double> overrides = new LinkedHashMap<>();
        overrides.put(SourceNames.VICTIM_REPORTS, victimReportsWeight);
        overrides.put(SourceNames.THREAT_INTELLIGENCE, threatIntelligenceWeight);
        overrides.put(SourceNames.VASP_REGISTRY, vaspRegistryWeight);
        overrides.put(SourceNames.ON_CHAIN_ANALYSIS, onChainAnalysisWeight);
        return SourceWeights.defaults().withOverrides(overrides);
    }

    boolean isEnabled(String source) {
        return enabledSources.map(list -> list.contains(source)).orElse(true);
    }
}

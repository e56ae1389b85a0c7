package com.attribution.consolidation.cdi;

import com.attribution.consolidation.api.AttributionService;
import com.attribution.consolidation.consensus.SourceWeights;
import com.attribution.consolidation.core.model.SourceNames;
import com.attribution.consolidation.source.OnChainAnalysisCollaborator;
import com.attribution.consolidation.source.ThreatIntelligenceCollaborator;
import com.attribution.consolidation.source.VaspAttributionCollaborator;
import com.attribution.consolidation.source.VictimReportsCollaborator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("AttributionProducer Tests")
class AttributionProducerTest {

    private AttributionProducer producer;

    @SuppressWarnings("unchecked")
    private static <T> Instance<T> instance(T bean) {
        Instance<T> instance = mock(Instance.class);
        when(instance.isResolvable()).thenReturn(bean != null);
        when(instance.get()).thenReturn(bean);
        return instance;
    }

    @BeforeEach
    void setUp() {
        producer = new AttributionProducer();
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 100;
        producer.cacheTtlSeconds = 60;
        producer.batchMaxConcurrent = 4;
        producer.batchMaxSize = 20;
        producer.sourceTimeoutSeconds = 2;
        producer.sourceThreads = 2;
        producer.enabledSources = Optional.empty();
        producer.victimReportsWeight = 0.8;
        producer.threatIntelligenceWeight = 0.9;
        producer.vaspRegistryWeight = 0.7;
        producer.onChainAnalysisWeight = 0.6;
        producer.victimReports = instance(mock(VictimReportsCollaborator.class));
        producer.threatIntelligence = instance(mock(ThreatIntelligenceCollaborator.class));
        producer.vaspRegistry = instance((VaspAttributionCollaborator) null);
        producer.onChainAnalysis = instance((OnChainAnalysisCollaborator) null);
        producer.meterRegistry = instance((MeterRegistry) null);
        producer.tracer = instance((Tracer) null);
    }

    @Test
    @DisplayName("Registers only the sources with a resolvable collaborator, plus on-chain analysis")
    void registersResolvableSources() {
        try (AttributionService service = producer.attributionService()) {
            assertEquals(List.of(SourceNames.VICTIM_REPORTS, SourceNames.THREAT_INTELLIGENCE,
                    SourceNames.ON_CHAIN_ANALYSIS), List.copyOf(service.getSources().keySet()));
            assertEquals(4, service.getDefaultOptions().getMaxConcurrent());
            assertEquals(20, service.getDefaultOptions().getMaxBatchSize());
        }
    }

    @Test
    @DisplayName("The enabled list restricts the registered sources")
    void enabledList() {
        producer.enabledSources = Optional.of(List.of(SourceNames.THREAT_INTELLIGENCE));

        try (AttributionService service = producer.attributionService()) {
            assertEquals(List.of(SourceNames.THREAT_INTELLIGENCE), List.copyOf(service.getSources().keySet()));
        }
        assertFalse(producer.isEnabled(SourceNames.VICTIM_REPORTS));
    }

    @Test
    @DisplayName("Configured weights override the defaults")
    void weights() {
        producer.vaspRegistryWeight = 0.95;

        SourceWeights weights = producer.sourceWeights();

        assertEquals(0.95, weights.weightOf(SourceNames.VASP_REGISTRY));
        assertEquals(1.0, weights.weightOf(SourceNames.MANUAL_INVESTIGATION));
    }

    @Test
    @DisplayName("A MeterRegistry bean switches on Micrometer metrics")
    void metrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        producer.meterRegistry = instance(registry);

        try (AttributionService service = producer.attributionService()) {
            service.getAttribution("0xabc", "ethereum");
        }

        assertEquals(1.0, registry.counter("attribution.cache.miss").count());
    }

    @Test
    @DisplayName("Disposal closes the service")
    void disposes() {
        AttributionService service = mock(AttributionService.class);

        producer.closeService(service);

        verify(service).close();
    }
}

package com.attribution.consolidation.api;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.core.model.ConfidenceLevel;
import com.attribution.consolidation.core.model.SourceContribution;
import com.attribution.consolidation.core.model.SourceNames;
import com.attribution.consolidation.metrics.MicrometerMetricsService;
import com.attribution.consolidation.tracing.NoOpTracingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchOrchestrator Tests")
class BatchOrchestratorTest {

    private ExecutorService executor;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BatchOrchestrator orchestrator(AddressConsolidator consolidator) {
        return new BatchOrchestrator(consolidator, executor,
                new MicrometerMetricsService(registry), new NoOpTracingService());
    }

    private static AttributionConsolidation consolidation(String address) {
        return AttributionConsolidation.builder()
                .address(address)
                .blockchain("ethereum")
                .attributions(List.of(Attribution.builder()
                        .address(address)
                        .blockchain("ethereum")
                        .entity("Exchange")
                        .source(SourceContribution.of(SourceNames.VICTIM_REPORTS, 0.8))
                        .build()))
                .consolidatedEntity("Exchange")
                .overallConfidence(ConfidenceLevel.HIGH)
                .supportingSources(Set.of(SourceNames.VICTIM_REPORTS))
                .consolidationScore(0.8)
                .build();
    }

    @Nested
    @DisplayName("Results")
    class Results {

        @Test
        @DisplayName("Duplicates are consolidated once and the map keeps request order")
        void duplicates() {
            Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
            BatchOrchestrator orchestrator = orchestrator((address, chain, options) -> {
                calls.computeIfAbsent(address, k -> new AtomicInteger()).incrementAndGet();
                return Optional.of(consolidation(address));
            });

            Map<String, AttributionConsolidation> result = orchestrator.consolidateMany(
                    List.of("0x2", "0x1", "0x2", "0x3"), "ethereum", ConsolidationOptions.defaults());

            assertEquals(List.of("0x2", "0x1", "0x3"), List.copyOf(result.keySet()));
            calls.values().forEach(count -> assertEquals(1, count.get()));
            assertEquals(3, calls.size());
            assertEquals(1, registry.summary("attribution.batch.size").count());
            assertEquals(3.0, registry.summary("attribution.batch.size").totalAmount());
        }

        @Test
        @DisplayName("Unattributed addresses map to null")
        void notFound() {
            BatchOrchestrator orchestrator = orchestrator((address, chain, options) ->
                    address.equals("0x1") ? Optional.of(consolidation(address)) : Optional.empty());

            Map<String, AttributionConsolidation> result = orchestrator.consolidateMany(
                    List.of("0x1", "0x2"), "ethereum", ConsolidationOptions.defaults());

            assertEquals(2, result.size());
            assertNotNull(result.get("0x1"));
            assertTrue(result.containsKey("0x2"));
            assertNull(result.get("0x2"));
        }

        @Test
        @DisplayName("A failing item becomes null without affecting the others")
        void failureIsolation() {
            BatchOrchestrator orchestrator = orchestrator((address, chain, options) -> {
                if (address.equals("bad")) {
                    throw new IllegalStateException("boom");
                }
                return Optional.of(consolidation(address));
            });

            Map<String, AttributionConsolidation> result = orchestrator.consolidateMany(
                    List.of("good", "bad", "also-good"), "ethereum", ConsolidationOptions.defaults());

            assertEquals(3, result.size());
            assertNull(result.get("bad"));
            assertNotNull(result.get("good"));
            assertNotNull(result.get("also-good"));
            assertEquals(1.0, registry.counter("attribution.batch.item.failure").count());
        }

        @Test
        @DisplayName("An empty batch completes immediately")
        void empty() {
            BatchHandle handle = orchestrator((address, chain, options) -> Optional.empty())
                    .consolidateManyAsync(List.of(), "ethereum", ConsolidationOptions.defaults(), null);

            assertTrue(handle.future().isDone());
            assertTrue(handle.future().join().isEmpty());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("No more than maxConcurrent items run at once")
        void bounded() {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            BatchOrchestrator orchestrator = orchestrator((address, chain, options) -> {
                int now = running.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(30);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    running.decrementAndGet();
                }
                return Optional.empty();
            });

            orchestrator.consolidateMany(List.of("a", "b", "c", "d", "e", "f", "g", "h"), "ethereum",
                    ConsolidationOptions.builder().maxConcurrent(2).build());

            assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
        }

        @Test
        @DisplayName("A large batch occupies no more than maxConcurrent pool threads")
        void boundedThreads() {
            ThreadPoolExecutor pool = (ThreadPoolExecutor) Executors.newCachedThreadPool();
            Set<String> workerThreads = ConcurrentHashMap.newKeySet();
            BatchOrchestrator orchestrator = new BatchOrchestrator((address, chain, options) -> {
                workerThreads.add(Thread.currentThread().getName());
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Optional.empty();
            }, pool);

            List<String> addresses = IntStream.range(0, 100).mapToObj(i -> "0x" + i).collect(Collectors.toList());
            try {
                Map<String, AttributionConsolidation> result = orchestrator.consolidateMany(addresses, "ethereum",
                        ConsolidationOptions.builder().maxConcurrent(2).build());

                assertEquals(100, result.size());
                assertTrue(pool.getLargestPoolSize() <= 2, "pool grew to " + pool.getLargestPoolSize());
                assertTrue(workerThreads.size() <= 2, "items ran on " + workerThreads);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("The listener sees every item, and its failures are ignored")
        void listener() throws InterruptedException {
            CountDownLatch seen = new CountDownLatch(3);
            Map<String, Boolean> found = new ConcurrentHashMap<>();
            BatchOrchestrator orchestrator = orchestrator((address, chain, options) ->
                    address.equals("0x3") ? Optional.empty() : Optional.of(consolidation(address)));

            BatchHandle handle = orchestrator.consolidateManyAsync(List.of("0x1", "0x2", "0x3"), "ethereum",
                    ConsolidationOptions.defaults(), (address, consolidation) -> {
                        found.put(address, consolidation != null);
                        seen.countDown();
                        throw new RuntimeException("listener bug");
                    });

            assertTrue(seen.await(5, TimeUnit.SECONDS));
            assertEquals(Map.of("0x1", true, "0x2", true, "0x3", false), found);
            assertEquals(3, handle.future().join().size());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancelling interrupts running items and keeps finished ones readable")
        void cancel() throws InterruptedException {
            CountDownLatch slowStarted = new CountDownLatch(2);
            CountDownLatch slowInterrupted = new CountDownLatch(2);
            CountDownLatch fastRecorded = new CountDownLatch(1);
            CountDownLatch never = new CountDownLatch(1);

            BatchOrchestrator orchestrator = orchestrator((address, chain, options) -> {
                if (address.equals("fast")) {
                    return Optional.of(consolidation(address));
                }
                slowStarted.countDown();
                try {
                    never.await();
                } catch (InterruptedException e) {
                    slowInterrupted.countDown();
                    Thread.currentThread().interrupt();
                    throw new CancellationException("interrupted");
                }
                return Optional.empty();
            });

            BatchHandle handle = orchestrator.consolidateManyAsync(List.of("fast", "slow-1", "slow-2"), "ethereum",
                    ConsolidationOptions.defaults(), (address, consolidation) -> fastRecorded.countDown());

            assertTrue(fastRecorded.await(5, TimeUnit.SECONDS));
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

            assertTrue(handle.cancel());

            assertTrue(slowInterrupted.await(5, TimeUnit.SECONDS));
            assertTrue(handle.isCancelled());
            assertTrue(handle.future().isCancelled());
            assertEquals(Set.of("fast"), handle.completedEntries().keySet());
            assertEquals(1, handle.completedCount());
        }
    }
}

package com.attribution.consolidation.source;

import com.attribution.consolidation.core.model.Attribution;
import com.attribution.consolidation.metrics.MetricsService;
import com.attribution.consolidation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queries every enabled {@link SourceAdapter} for one address in parallel and joins the results.
 *
 * <p>Each call gets {@code sourceTimeout} of running time, measured from the moment a worker
 * picks it up; time spent queued for a worker does not count, but a call that waits longer than
 * {@code sourceTimeout} for one is given up. A call that misses either limit is cancelled (its
 * worker interrupted), logged and counted as a source failure; the other sources' results are
 * kept. Results are returned in adapter registration order.</p>
 *
 * <p>If the calling thread is interrupted while waiting, every outstanding call is cancelled and
 * a {@link CancellationException} is thrown.</p>
 */
public class SourceFanOut {
    private static final Logger log = LoggerFactory.getLogger(SourceFanOut.class);

    private final Map<String, SourceAdapter> adapters;
    private final ExecutorService executor;
    private final MetricsService metricsService;

    public SourceFanOut(Collection<? extends SourceAdapter> adapters, ExecutorService executor,
                        MetricsService metricsService) {
        Objects.requireNonNull(adapters, "adapters is required");
        this.adapters = new LinkedHashMap<>();
        for (SourceAdapter adapter : adapters) {
            if (this.adapters.putIfAbsent(adapter.sourceName(), adapter) != null) {
                throw new IllegalArgumentException("Duplicate source adapter: " + adapter.sourceName());
            }
        }
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Returns the names of the registered sources, in registration order.
     */
    public Set<String> sourceNames() {
        return Collections.unmodifiableSet(adapters.keySet());
    }

    /**
     * Fetches attributions for an address from the selected sources, dropping the ones that failed.
     *
     * @see #fetch(String, String, Set, Duration)
     */
    public List<Attribution> fetchAll(String address, String blockchain, Set<String> sourceFilter,
                                      Duration timeout) {
        return fetch(address, blockchain, sourceFilter, timeout).attributions();
    }

    /**
     * Fetches attributions for an address from the selected sources.
     *
     * @param sourceFilter source names to query; {@code null} or empty queries every source
     * @param timeout      running time allowed to each source
     * @return the attributions, and the sources that timed out or threw
     */
    public SourceResults fetch(String address, String blockchain, Set<String> sourceFilter, Duration timeout) {
        long timeoutNanos = timeout.toNanos();
        List<SourceCall> calls = new ArrayList<>();
        for (SourceAdapter adapter : adapters.values()) {
            if (sourceFilter != null && !sourceFilter.isEmpty() && !sourceFilter.contains(adapter.sourceName())) {
                continue;
            }
            SourceCall call = new SourceCall(adapter.sourceName());
            call.future = executor.submit(() -> call.run(() -> timedFetch(adapter, address, blockchain)));
            calls.add(call);
        }

        List<Attribution> collected = new ArrayList<>();
        Set<String> unavailable = new TreeSet<>();
        for (SourceCall call : calls) {
            try {
                collected.addAll(await(call, timeoutNanos));
            } catch (TimeoutException e) {
                call.future.cancel(true);
                log.warn("source.timeout source={} address={} blockchain={} timeoutMs={} started={}",
                        call.source, address, blockchain, timeout.toMillis(), call.started);
                metricsService.incrementSourceFailure(call.source);
                unavailable.add(call.source);
            } catch (ExecutionException e) {
                // adapters outside AbstractSourceAdapter may still throw
                log.warn("source.failed source={} address={} blockchain={} error={}",
                        call.source, address, blockchain, e.getCause().getMessage(), e.getCause());
                metricsService.incrementSourceFailure(call.source);
                unavailable.add(call.source);
            } catch (CancellationException e) {
                log.debug("source.cancelled source={} address={}", call.source, address);
                unavailable.add(call.source);
            } catch (InterruptedException e) {
                calls.forEach(c -> c.future.cancel(true));
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while fetching sources for " + address);
            }
        }
        return new SourceResults(collected, unavailable);
    }

    /**
     * Waits for one call: up to {@code timeoutNanos} for a worker to pick it up, then up to
     * {@code timeoutNanos} of running time.
     */
    private static List<Attribution> await(SourceCall call, long timeoutNanos)
            throws InterruptedException, ExecutionException, TimeoutException {
        while (true) {
            boolean running = call.started;
            long deadline = (running ? call.startedAt : call.submittedAt) + timeoutNanos;
            try {
                return call.future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                // a call picked up while queued gets its full running time
                if (running || !call.started) {
                    throw e;
                }
            }
        }
    }

    private List<Attribution> timedFetch(SourceAdapter adapter, String address, String blockchain) {
        long start = System.nanoTime();
        try {
            return adapter.fetch(address, blockchain);
        } finally {
            metricsService.recordSourceDuration(adapter.sourceName(), Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * One submitted source call and the time a worker started running it.
     */
    private static final class SourceCall {
        private final String source;
        private final long submittedAt = System.nanoTime();
        private volatile long startedAt;
        private volatile boolean started;
        private Future<List<Attribution>> future;

        private SourceCall(String source) {
            this.source = source;
        }

        private List<Attribution> run(Callable<List<Attribution>> fetch) throws Exception {
            startedAt = System.nanoTime();
            started = true;
            return fetch.call();
        }
    }
}

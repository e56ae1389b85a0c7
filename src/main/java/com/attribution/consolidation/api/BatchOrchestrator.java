package com.attribution.consolidation.api;

import com.attribution.consolidation.core.model.AttributionConsolidation;
import com.attribution.consolidation.logging.LogContext;
import com.attribution.consolidation.metrics.MetricsService;
import com.attribution.consolidation.metrics.NoOpMetricsService;
import com.attribution.consolidation.tracing.NoOpTracingService;
import com.attribution.consolidation.tracing.Span;
import com.attribution.consolidation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Consolidates lists of addresses with bounded concurrency.
 *
 * <p>A batch puts its distinct addresses on a queue and submits {@code min(maxConcurrent, size)}
 * workers to the shared batch executor; each worker takes addresses off the queue until it is
 * empty. A batch therefore never occupies more than {@code maxConcurrent} threads, however many
 * addresses it holds. A failing item is logged, counted and reported as a {@code null} entry, so
 * the result always has one entry per distinct requested address.</p>
 */
public class BatchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final AddressConsolidator consolidator;
    private final ExecutorService executor;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public BatchOrchestrator(AddressConsolidator consolidator, ExecutorService executor) {
        this(consolidator, executor, new NoOpMetricsService(), new NoOpTracingService());
    }

    public BatchOrchestrator(AddressConsolidator consolidator, ExecutorService executor,
                             MetricsService metricsService, TracingService tracingService) {
        this.consolidator = Objects.requireNonNull(consolidator, "consolidator is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Consolidates every address and waits for the whole batch.
     *
     * @return insertion-ordered map keyed by the caller's address strings; {@code null} values
     *         for addresses with no attribution or whose consolidation failed
     * @throws CancellationException if the calling thread is interrupted while waiting
     */
    public Map<String, AttributionConsolidation> consolidateMany(List<String> addresses, String blockchain,
                                                                 ConsolidationOptions options) {
        BatchHandle handle = consolidateManyAsync(addresses, blockchain, options, BatchItemListener.NONE);
        try {
            return handle.future().get();
        } catch (InterruptedException e) {
            handle.cancel();
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for batch " + handle.batchId());
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        }
    }

    /**
     * Starts consolidating every address and returns immediately.
     *
     * @param listener notified as each item finishes, from a worker thread
     */
    public BatchHandle consolidateManyAsync(List<String> addresses, String blockchain,
                                            ConsolidationOptions options, BatchItemListener listener) {
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(addresses));
        String batchId = LogContext.generateCorrelationId();
        BatchHandle handle = new BatchHandle(batchId, distinct);
        BatchItemListener itemListener = listener != null ? listener : BatchItemListener.NONE;

        metricsService.recordBatchSize(distinct.size());
        Span span = tracingService.startBatch(batchId, blockchain, distinct.size(), options.getMaxConcurrent());
        long start = System.nanoTime();

        try (LogContext ignored = LogContext.forBatch(batchId, blockchain, distinct.size())) {
            log.info("batch.started batchId={} blockchain={} addresses={} maxConcurrent={}",
                    batchId, blockchain, distinct.size(), options.getMaxConcurrent());
        }

        if (distinct.isEmpty()) {
            handle.complete();
            span.recordBatchCompleted(0, 0);
            span.close();
            return handle;
        }

        Queue<String> pending = new ConcurrentLinkedQueue<>(distinct);
        int workers = Math.min(options.getMaxConcurrent(), distinct.size());
        List<Future<?>> tasks = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            tasks.add(executor.submit(() -> drain(handle, pending, blockchain, options, itemListener)));
        }

        handle.future().whenComplete((result, error) -> {
            if (handle.isCancelled()) {
                tasks.forEach(task -> task.cancel(true));
                log.info("batch.cancelled batchId={} completed={} of {}",
                        batchId, handle.completedCount(), distinct.size());
                span.recordBatchCancelled(handle.completedCount(), distinct.size());
            } else {
                long found = result.values().stream().filter(Objects::nonNull).count();
                log.info("batch.completed batchId={} addresses={} found={} durationMs={}",
                        batchId, distinct.size(), found, (System.nanoTime() - start) / 1_000_000);
                span.recordBatchCompleted(found, distinct.size());
            }
            span.close();
        });
        return handle;
    }

    /**
     * One worker: consolidates queued addresses until the queue is empty or the batch is cancelled.
     */
    private void drain(BatchHandle handle, Queue<String> pending, String blockchain,
                       ConsolidationOptions options, BatchItemListener listener) {
        String address;
        while (!handle.isCancelled() && !Thread.currentThread().isInterrupted()
                && (address = pending.poll()) != null) {
            AttributionConsolidation result = consolidateItem(handle.batchId(), address, blockchain, options);

            // a cancelled item is not recorded
            if (handle.isCancelled() || Thread.currentThread().isInterrupted()) {
                return;
            }
            boolean last = handle.record(address, result);
            notifyListener(listener, address, result);
            if (last) {
                handle.complete();
            }
        }
    }

    private AttributionConsolidation consolidateItem(String batchId, String address, String blockchain,
                                                     ConsolidationOptions options) {
        try {
            Optional<AttributionConsolidation> consolidation = consolidator.consolidate(address, blockchain, options);
            return consolidation.orElse(null);
        } catch (CancellationException e) {
            log.debug("batch.item.cancelled batchId={} address={}", batchId, address);
            return null;
        } catch (RuntimeException e) {
            log.error("batch.item.failed batchId={} address={} blockchain={} error={}",
                    batchId, address, blockchain, e.getMessage(), e);
            metricsService.incrementBatchItemFailure();
            return null;
        }
    }

    private void notifyListener(BatchItemListener listener, String address, AttributionConsolidation result) {
        try {
            listener.onItem(address, result);
        } catch (RuntimeException e) {
            log.warn("batch.listener.failed address={} error={}", address, e.getMessage(), e);
        }
    }
}

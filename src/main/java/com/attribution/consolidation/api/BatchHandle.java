package com.attribution.consolidation.api;

import com.attribution.consolidation.core.model.AttributionConsolidation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A running batch. {@link #future()} completes with one entry per distinct address, in request
 * order. Cancelling either the handle or the future stops admission of pending items and
 * interrupts the ones in flight; entries finished before that stay readable through
 * {@link #completedEntries()}.
 */
public final class BatchHandle {

    private final String batchId;
    private final List<String> addresses;
    private final CompletableFuture<Map<String, AttributionConsolidation>> future;
    private final ConcurrentMap<String, Optional<AttributionConsolidation>> completed = new ConcurrentHashMap<>();
    private final AtomicInteger remaining;

    BatchHandle(String batchId, List<String> addresses) {
        this.batchId = batchId;
        this.addresses = List.copyOf(addresses);
        this.future = new CompletableFuture<>();
        this.remaining = new AtomicInteger(this.addresses.size());
    }

    public String batchId() {
        return batchId;
    }

    public CompletableFuture<Map<String, AttributionConsolidation>> future() {
        return future;
    }

    /**
     * Cancels the batch.
     *
     * @return {@code true} if the batch was still running
     */
    public boolean cancel() {
        return future.cancel(true);
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }

    public int completedCount() {
        return completed.size();
    }

    /**
     * Snapshot of finished items in request order. Values are {@code null} for items that found nothing or failed.
     */
    public Map<String, AttributionConsolidation> completedEntries() {
        Map<String, AttributionConsolidation> snapshot = new LinkedHashMap<>();
        for (String address : addresses) {
            Optional<AttributionConsolidation> result = completed.get(address);
            if (result != null) {
                snapshot.put(address, result.orElse(null));
            }
        }
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Records one finished item.
     *
     * @return {@code true} if this was the last outstanding item
     */
    boolean record(String address, AttributionConsolidation consolidation) {
        completed.put(address, Optional.ofNullable(consolidation));
        return remaining.decrementAndGet() == 0;
    }

    void complete() {
        future.complete(completedEntries());
    }
}

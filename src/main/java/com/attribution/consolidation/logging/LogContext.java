package com.attribution.consolidation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Keys added through a context are removed again on close,
 * and keys that were already present are restored to their previous value.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forConsolidation(correlationId, address, "ethereum")) {
 *     log.info("attribution.consolidated entity={} confidence={}", entity, confidence);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previous = new HashMap<>();

    private LogContext() {
    }

    public static LogContext forConsolidation(String correlationId, String address, String blockchain) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("address", address);
        ctx.put("blockchain", blockchain);
        ctx.put("operation", "consolidate");
        return ctx;
    }

    public static LogContext forBatch(String batchId, String blockchain, int size) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("blockchain", blockchain);
        ctx.put("batchSize", String.valueOf(size));
        ctx.put("operation", "batch");
        return ctx;
    }

    public static LogContext forSource(String source, String address) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put("address", address);
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!keys.contains(key)) {
            keys.add(key);
            String existing = MDC.get(key);
            if (existing != null) {
                previous.put(key, existing);
            }
        }
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    @Override
    public void close() {
        for (String key : keys) {
            String restored = previous.get(key);
            if (restored != null) {
                MDC.put(key, restored);
            } else {
                MDC.remove(key);
            }
        }
        keys.clear();
        previous.clear();
    }
}

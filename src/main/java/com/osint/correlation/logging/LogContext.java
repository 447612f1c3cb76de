package com.osint.correlation.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAggregation(batchId)) {
 *     log.info("aggregation.started sources={}", sources.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forAggregation(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "aggregate");
        return ctx;
    }

    public static LogContext forSource(String batchId, String sourceName) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("source", sourceName);
        ctx.put("operation", "source-query");
        return ctx;
    }

    public static LogContext forCorrelation(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "correlate");
        return ctx;
    }

    public static LogContext forMerge(String sourceId, String targetId) {
        LogContext ctx = new LogContext();
        ctx.put("sourceEntityId", sourceId);
        ctx.put("targetEntityId", targetId);
        ctx.put("operation", "merge");
        return ctx;
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}

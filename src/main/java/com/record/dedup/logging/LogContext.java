package com.record.dedup.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close,
 * so contexts can be nested.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forDeduplication(runId, records.size())) {
 *     log.info("dedup.completed groups={}", result.groupCount());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    // key -> value it replaced, null when the key was absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a deduplication run.
     */
    public static LogContext forDeduplication(String runId, int recordCount) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("recordCount", String.valueOf(recordCount));
        ctx.put("operation", "deduplicate");
        return ctx;
    }

    /**
     * Creates a log context for import and export of tabular data.
     */
    public static LogContext forTransfer(String operation, String source) {
        LogContext ctx = new LogContext();
        ctx.put("operation", operation);
        ctx.put("source", source);
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
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
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    /**
     * Restores every key to the value it had when this context was opened.
     */
    @Override
    public void close() {
        for (Map.Entry<String, String> entry : previous.entrySet()) {
            if (entry.getValue() == null) {
                MDC.remove(entry.getKey());
            } else {
                MDC.put(entry.getKey(), entry.getValue());
            }
        }
        previous.clear();
    }
}

package com.geo.match.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forFetch(correlationId, "stores.csv")) {
 *     log.info("fetch.started rows={}", rows);
 * } // MDC entries are cleared here
 * </pre>
 *
 * <p>MDC is thread-local: fetch worker threads do not inherit the submitting
 * thread's context.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a geocoding run over one table.
     */
    public static LogContext forFetch(String correlationId, String table) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("table", table);
        ctx.put("operation", "fetch");
        return ctx;
    }

    /**
     * Creates a log context for a merge run.
     */
    public static LogContext forMerge(String correlationId, String joinMode) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("joinMode", joinMode);
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
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

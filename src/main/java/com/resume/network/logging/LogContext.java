package com.resume.network.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSearch(correlationId, "similar")) {
 *     log.info("search.completed matches={}", matches);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a search request.
     */
    public static LogContext forSearch(String correlationId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Creates a log context for a resume ingestion batch.
     */
    public static LogContext forIngestion(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "ingest");
        return ctx;
    }

    /**
     * Creates a log context for natural-language translation.
     */
    public static LogContext forTranslation(String correlationId, String oracleName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("oracle", oracleName);
        ctx.put("operation", "translate");
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

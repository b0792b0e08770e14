package com.world.registry.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSource("base-registry")) {
 *     log.warn("store.attribute.malformed entity='{}'", name);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one registry build stage (store, canonical, index).
     */
    public static LogContext forBuild(String stage) {
        LogContext ctx = new LogContext();
        ctx.put("operation", "build");
        ctx.put("stage", stage);
        return ctx;
    }

    /**
     * Creates a log context for parsing one declaration source.
     */
    public static LogContext forSource(String sourceId) {
        LogContext ctx = new LogContext();
        ctx.put("operation", "parse");
        ctx.put("sourceId", sourceId);
        return ctx;
    }

    /**
     * Creates a log context for an event overlay batch.
     */
    public static LogContext forOverlay(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "overlay");
        return ctx;
    }

    /**
     * Creates a log context for resolving a single query.
     */
    public static LogContext forResolution(String correlationId, String kind) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("identityKind", kind);
        ctx.put("operation", "resolve");
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

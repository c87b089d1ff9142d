package com.fleet.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forResolution("getNodeScaleSetId", nodeName)) {
 *     log.info("node.resolved scaleSetId={}", scaleSetId);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a resolution operation against one target
     * (a node name, VM name or scale-set ID).
     */
    public static LogContext forResolution(String operation, String target) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("operation", operation);
        ctx.put("target", target);
        return ctx;
    }

    /**
     * Creates a log context for an index invalidation.
     */
    public static LogContext forInvalidation(String nodeName) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("operation", "invalidateNode");
        ctx.put("target", nodeName);
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

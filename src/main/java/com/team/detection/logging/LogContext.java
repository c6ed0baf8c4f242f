package com.team.detection.logging;

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
 * try (LogContext ctx = LogContext.forVisit(numericId, depth)) {
 *     log.info("crawl.visited numericId={} candidates={}", numericId, count);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole detection run.
     */
    public static LogContext forRun(String runId, String rosterReference) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("roster", rosterReference);
        ctx.put("operation", "detect");
        return ctx;
    }

    /**
     * Creates a log context for the visit of one profile.
     */
    public static LogContext forVisit(String numericId, int depth) {
        LogContext ctx = new LogContext();
        ctx.put("numericId", numericId);
        ctx.put("depth", Integer.toString(depth));
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

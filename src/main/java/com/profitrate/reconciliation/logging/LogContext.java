package com.profitrate.reconciliation.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them again on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forVariable("K", "merge")) {
 *     log.info("merge.completed variableId={} conflicts={}", variableId, conflicts.size());
 * } // MDC entries are cleared
 * </pre>
 *
 * <p>MDC is thread-local, so each variable chain running on a worker thread gets its
 * own context. Nested contexts restore the outer value of a key on close.</p>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole reconciliation run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    /**
     * Creates a log context for one stage of a variable chain.
     */
    public static LogContext forVariable(String variableId, String stage) {
        LogContext ctx = new LogContext();
        ctx.put("variableId", variableId);
        ctx.put("stage", stage);
        return ctx;
    }

    /**
     * Creates a log context for the validation of one identity.
     */
    public static LogContext forIdentity(String identityName) {
        LogContext ctx = new LogContext();
        ctx.put("identity", identityName);
        ctx.put("stage", "validate");
        return ctx;
    }

    /**
     * Generates a unique run ID. Used for log correlation only; never written to outputs.
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

    @Override
    public void close() {
        previous.forEach((key, outer) -> {
            if (outer == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, outer);
            }
        });
        previous.clear();
    }
}

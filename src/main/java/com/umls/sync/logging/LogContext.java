package com.umls.sync.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSync(runId, "2025AA")) {
 *     log.info("sync.phaseCompleted phase={}", phase);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a whole synchronization run.
     */
    public static LogContext forSync(String runId, String version) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("version", version);
        ctx.put("operation", "sync");
        return ctx;
    }

    /**
     * Context for one reconciliation phase; nest inside {@link #forSync}.
     */
    public static LogContext forPhase(String phase) {
        LogContext ctx = new LogContext();
        ctx.put("phase", phase);
        return ctx;
    }

    /**
     * Context for the extraction of one release file.
     */
    public static LogContext forExtraction(String file) {
        LogContext ctx = new LogContext();
        ctx.put("file", file);
        return ctx;
    }

    public static String generateRunId() {
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

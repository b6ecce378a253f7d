package com.company.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext batch = LogContext.forBatch(runId, batchId)) {
 *     try (LogContext cluster = LogContext.forCluster(clusterId)) {
 *         log.info("cluster.enriched status={}", status);
 *     }
 * }
 * </pre>
 *
 * <p>MDC is thread-local: open the context on the thread that does the logging.</p>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String BATCH_ID = "batchId";
    public static final String CLUSTER_ID = "clusterId";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a whole pipeline step.
     */
    public static LogContext forRun(String runId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(OPERATION, operation);
        return ctx;
    }

    public static LogContext forBatch(String runId, String batchId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(BATCH_ID, batchId);
        ctx.put(OPERATION, "enrich");
        return ctx;
    }

    public static LogContext forCluster(String clusterId) {
        LogContext ctx = new LogContext();
        ctx.put(CLUSTER_ID, clusterId);
        return ctx;
    }

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

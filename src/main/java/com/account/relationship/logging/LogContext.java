package com.account.relationship.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. On close, every key set through this context is restored to the
 * value it had before, so contexts can nest (a batch worker evaluating one record).
 *
 * <pre>
 * try (LogContext ctx = LogContext.forEvaluation(recordId)) {
 *     log.info("flags.evaluated recordId={} stage={}", recordId, stage);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Context for the evaluation of a single record.
     */
    public static LogContext forEvaluation(String recordId) {
        LogContext ctx = new LogContext();
        ctx.put("recordId", recordId);
        ctx.put("operation", "evaluate");
        return ctx;
    }

    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    /**
     * Context for an assessment run over a list of requested ids.
     */
    public static LogContext forAssessment(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "assess");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

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
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}

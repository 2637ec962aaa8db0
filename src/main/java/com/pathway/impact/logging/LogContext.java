package com.pathway.impact.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Keys put through a context are removed again when it closes, so worker threads of the
 * job pool never leak one analysis' identifiers into the next.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAnalysis(analysisId, "imatinib")) {
 *     log.info("analysis.completed pathways={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String ANALYSIS_ID = "analysisId";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forAnalysis(String analysisId, String query) {
        LogContext ctx = new LogContext();
        ctx.put(ANALYSIS_ID, analysisId);
        ctx.put("query", query);
        ctx.put(OPERATION, "analyze");
        return ctx;
    }

    public static LogContext forComparison(String leftAnalysisId, String rightAnalysisId) {
        LogContext ctx = new LogContext();
        ctx.put("leftAnalysisId", leftAnalysisId);
        ctx.put("rightAnalysisId", rightAnalysisId);
        ctx.put(OPERATION, "compare");
        return ctx;
    }

    public static LogContext forEtl(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("etlRunId", runId);
        ctx.put(OPERATION, "etl");
        return ctx;
    }

    /**
     * Generates a fresh identifier for analyses, shares and ETL runs.
     */
    public static String newId() {
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

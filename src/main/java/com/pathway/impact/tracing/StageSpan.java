package com.pathway.impact.tracing;

/**
 * One traced pipeline stage. Closing the span ends it, so stages are traced with
 * try-with-resources:
 *
 * <pre>
 * try (StageSpan span = tracing.startStage(PipelineStage.SCORE, analysisId)) {
 *     span.tag("pathways", scores.size());
 * }
 * </pre>
 */
public interface StageSpan extends AutoCloseable {

    StageSpan tag(String key, String value);

    StageSpan tag(String key, long value);

    /**
     * Marks the stage as failed and records the cause.
     */
    void fail(Throwable cause);

    @Override
    void close();
}

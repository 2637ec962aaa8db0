package com.pathway.impact.tracing;

/**
 * Seam for distributed tracing of analysis runs.
 * The default {@link NoOpTracingService} records nothing.
 */
public interface TracingService {

    StageSpan startStage(PipelineStage stage, String analysisId);
}

package com.pathway.impact.tracing;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * OpenTelemetry-based implementation of {@link TracingService}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 * Span names are {@code pathway-impact.<stage>}; every span carries the analysis id.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String SPAN_PREFIX = "pathway-impact.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public StageSpan startStage(PipelineStage stage, String analysisId) {
        Span span = tracer.spanBuilder(SPAN_PREFIX + stage.spanName())
                .setAttribute("analysis.id", analysisId != null ? analysisId : "")
                .startSpan();
        return new OTelStageSpan(span);
    }

    private static final class OTelStageSpan implements StageSpan {

        private final Span span;
        private boolean failed;

        OTelStageSpan(Span span) {
            this.span = span;
        }

        @Override
        public StageSpan tag(String key, String value) {
            span.setAttribute(key, value);
            return this;
        }

        @Override
        public StageSpan tag(String key, long value) {
            span.setAttribute(key, value);
            return this;
        }

        @Override
        public void fail(Throwable cause) {
            failed = true;
            span.recordException(cause);
            span.setStatus(StatusCode.ERROR, cause.getMessage() != null ? cause.getMessage() : "");
        }

        @Override
        public void close() {
            if (!failed) {
                span.setStatus(StatusCode.OK);
            }
            span.end();
        }
    }
}

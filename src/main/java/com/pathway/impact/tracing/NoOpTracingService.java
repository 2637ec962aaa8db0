package com.pathway.impact.tracing;

/**
 * No-op implementation of {@link TracingService}. Returns one shared inert span.
 */
public class NoOpTracingService implements TracingService {

    private static final StageSpan NOOP_SPAN = new StageSpan() {
        @Override
        public StageSpan tag(String key, String value) {
            return this;
        }

        @Override
        public StageSpan tag(String key, long value) {
            return this;
        }

        @Override
        public void fail(Throwable cause) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public StageSpan startStage(PipelineStage stage, String analysisId) {
        return NOOP_SPAN;
    }
}

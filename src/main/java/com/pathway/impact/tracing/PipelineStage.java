package com.pathway.impact.tracing;

/**
 * Stages of an analysis run, in execution order.
 */
public enum PipelineStage {
    RESOLVE("resolve"),
    AGGREGATE("aggregate"),
    SCORE("score"),
    GRAPH("graph"),
    SNAPSHOT("snapshot");

    private final String spanName;

    PipelineStage(String spanName) {
        this.spanName = spanName;
    }

    public String spanName() {
        return spanName;
    }
}

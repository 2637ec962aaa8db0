package com.pathway.impact.compare;

import com.pathway.impact.api.AnalysisResult;

import java.util.List;
import java.util.Objects;

public record CompareResult(
        AnalysisResult analysisA,
        AnalysisResult analysisB,
        List<PathwayComparisonRow> rows,
        CompareMetrics metrics
) {
    public CompareResult {
        Objects.requireNonNull(analysisA, "analysisA is required");
        Objects.requireNonNull(analysisB, "analysisB is required");
        Objects.requireNonNull(metrics, "metrics is required");
        rows = rows != null ? List.copyOf(rows) : List.of();
    }
}

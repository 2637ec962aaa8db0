package com.pathway.impact.metrics;

import com.pathway.impact.core.model.ResolutionStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAnalysisDuration(String outcome, Duration duration) {
    }

    @Override
    public void incrementResolution(ResolutionStatus status) {
    }

    @Override
    public void recordTargetCount(int count) {
    }

    @Override
    public void recordPathwayCount(int count) {
    }

    @Override
    public void incrementUpstreamRetry(String source) {
    }

    @Override
    public void incrementDegraded(String reason) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}

package com.pathway.impact.metrics;

import com.pathway.impact.core.model.ResolutionStatus;

import java.time.Duration;

/**
 * Interface for recording engine metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine works without any
 * metrics dependency on the classpath.
 */
public interface MetricsService {

    void recordAnalysisDuration(String outcome, Duration duration);

    void incrementResolution(ResolutionStatus status);

    void recordTargetCount(int count);

    void recordPathwayCount(int count);

    void incrementUpstreamRetry(String source);

    void incrementDegraded(String reason);

    void recordCacheHit();

    void recordCacheMiss();
}

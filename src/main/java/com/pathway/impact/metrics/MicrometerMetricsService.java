package com.pathway.impact.metrics;

import com.pathway.impact.core.model.ResolutionStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code analysis.duration} (Timer, tag: outcome)</li>
 *   <li>{@code identity.resolution} (Counter, tag: status)</li>
 *   <li>{@code analysis.targets}, {@code analysis.pathways} (DistributionSummary)</li>
 *   <li>{@code upstream.retry} (Counter, tag: source)</li>
 *   <li>{@code analysis.degraded} (Counter, tag: reason)</li>
 *   <li>{@code identity.cache.hit}, {@code identity.cache.miss} (Counter)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary targetCountSummary;
    private final DistributionSummary pathwayCountSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.targetCountSummary = DistributionSummary.builder("analysis.targets")
                .description("Number of target summaries per analysis")
                .register(registry);
        this.pathwayCountSummary = DistributionSummary.builder("analysis.pathways")
                .description("Number of pathways displayed per analysis")
                .register(registry);
        this.cacheHitCounter = Counter.builder("identity.cache.hit")
                .description("Number of identity cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("identity.cache.miss")
                .description("Number of identity cache misses")
                .register(registry);
    }

    @Override
    public void recordAnalysisDuration(String outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome, k ->
                Timer.builder("analysis.duration")
                        .description("Duration of analysis runs")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementResolution(ResolutionStatus status) {
        counter("identity.resolution", "status", status.wireName(), "Identity resolutions by status").increment();
    }

    @Override
    public void recordTargetCount(int count) {
        targetCountSummary.record(count);
    }

    @Override
    public void recordPathwayCount(int count) {
        pathwayCountSummary.record(count);
    }

    @Override
    public void incrementUpstreamRetry(String source) {
        counter("upstream.retry", "source", source, "Retries of transient upstream failures").increment();
    }

    @Override
    public void incrementDegraded(String reason) {
        counter("analysis.degraded", "reason", reason, "Analyses that proceeded with partial data").increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return counterCache.computeIfAbsent(name + ":" + tagValue, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}

package com.pathway.impact.cdi;

import com.pathway.impact.aggregate.ActivityProvider;
import com.pathway.impact.api.AnalysisParams;
import com.pathway.impact.api.PathwayImpactEngine;
import com.pathway.impact.cache.CacheConfig;
import com.pathway.impact.hierarchy.PathwaySource;
import com.pathway.impact.identity.IdentityProvider;
import com.pathway.impact.identity.StructureStandardizer;
import com.pathway.impact.jobs.JobConfig;
import com.pathway.impact.metrics.MicrometerMetricsService;
import com.pathway.impact.tracing.OpenTelemetryTracingService;
import com.pathway.impact.upstream.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that wires the pathway impact library from MicroProfile Config properties.
 *
 * <p>The host application supplies the upstream adapters as beans: an {@link IdentityProvider}
 * and an {@link ActivityProvider} are required, a {@link PathwaySource},
 * {@link StructureStandardizer}, Micrometer {@link MeterRegistry} and OpenTelemetry
 * {@link Tracer} are picked up when present.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * pathway-impact:
 *   analysis:
 *     potency-threshold: 5.0
 *     min-assays: 2
 *   cache:
 *     max-size: 10000
 *   retry:
 *     max-attempts: 3
 * </pre>
 */
@ApplicationScoped
public class PathwayImpactProducer {

    private static final Logger log = LoggerFactory.getLogger(PathwayImpactProducer.class);

    // ── Analysis defaults ─────────────────────────────────────

    @Inject
    @ConfigProperty(name = "pathway-impact.analysis.potency-threshold", defaultValue = "5.0")
    double potencyThreshold;

    @Inject
    @ConfigProperty(name = "pathway-impact.analysis.min-assays", defaultValue = "2")
    int minAssays;

    @Inject
    @ConfigProperty(name = "pathway-impact.analysis.include-low-confidence", defaultValue = "false")
    boolean includeLowConfidence;

    @Inject
    @ConfigProperty(name = "pathway-impact.analysis.top-pathways", defaultValue = "20")
    int topPathways;

    @Inject
    @ConfigProperty(name = "pathway-impact.analysis.min-depth", defaultValue = "3")
    int minDepth;

    @Inject
    @ConfigProperty(name = "pathway-impact.analysis.max-depth", defaultValue = "5")
    int maxDepth;

    @Inject
    @ConfigProperty(name = "pathway-impact.analysis.max-targets", defaultValue = "50")
    int maxTargets;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "pathway-impact.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "pathway-impact.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "pathway-impact.cache.ttl-seconds", defaultValue = "86400")
    int cacheTtlSeconds;

    // ── Retry ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "pathway-impact.retry.max-attempts", defaultValue = "3")
    int retryMaxAttempts;

    @Inject
    @ConfigProperty(name = "pathway-impact.retry.initial-delay-millis", defaultValue = "200")
    long retryInitialDelayMillis;

    @Inject
    @ConfigProperty(name = "pathway-impact.retry.multiplier", defaultValue = "2.0")
    double retryMultiplier;

    @Inject
    @ConfigProperty(name = "pathway-impact.retry.max-delay-millis", defaultValue = "2000")
    long retryMaxDelayMillis;

    // ── Jobs ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "pathway-impact.jobs.worker-threads", defaultValue = "4")
    int jobWorkerThreads;

    @Inject
    @ConfigProperty(name = "pathway-impact.jobs.timeout-seconds", defaultValue = "120")
    long jobTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "pathway-impact.jobs.retention-minutes", defaultValue = "60")
    long jobRetentionMinutes;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public PathwayImpactEngine pathwayImpactEngine(IdentityProvider identityProvider,
                                                   ActivityProvider activityProvider,
                                                   Instance<PathwaySource> pathwaySource,
                                                   Instance<StructureStandardizer> standardizer,
                                                   Instance<MeterRegistry> meterRegistry,
                                                   Instance<Tracer> tracer) {
        log.info("Producing PathwayImpactEngine: identity={} activity={}",
                identityProvider.sourceName(), activityProvider.sourceName());

        PathwayImpactEngine.Builder builder = PathwayImpactEngine.builder()
                .identityProvider(identityProvider)
                .activityProvider(activityProvider)
                .cacheConfig(cacheConfig())
                .retryPolicy(retryPolicy())
                .jobConfig(jobConfig());

        if (pathwaySource.isResolvable()) {
            builder.pathwaySource(pathwaySource.get());
        }
        if (standardizer.isResolvable()) {
            builder.structureStandardizer(standardizer.get());
        }
        if (meterRegistry.isResolvable()) {
            builder.metricsService(new MicrometerMetricsService(meterRegistry.get()));
            log.info("Micrometer metrics enabled");
        }
        if (tracer.isResolvable()) {
            builder.tracingService(new OpenTelemetryTracingService(tracer.get()));
            log.info("OpenTelemetry tracing enabled");
        }
        return builder.build();
    }

    public void closeEngine(@Disposes PathwayImpactEngine engine) {
        log.info("Closing PathwayImpactEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public AnalysisParams defaultAnalysisParams() {
        return AnalysisParams.builder()
                .potencyThreshold(potencyThreshold)
                .minAssays(minAssays)
                .includeLowConfidence(includeLowConfidence)
                .topPathways(topPathways)
                .depthBand(minDepth, maxDepth)
                .maxTargets(maxTargets)
                .build();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    CacheConfig cacheConfig() {
        return new CacheConfig(cacheMaxSize, cacheTtlSeconds, cacheEnabled);
    }

    RetryPolicy retryPolicy() {
        return new RetryPolicy(retryMaxAttempts, Duration.ofMillis(retryInitialDelayMillis),
                retryMultiplier, Duration.ofMillis(retryMaxDelayMillis));
    }

    JobConfig jobConfig() {
        return new JobConfig(jobWorkerThreads, Duration.ofSeconds(jobTimeoutSeconds),
                Duration.ofMinutes(jobRetentionMinutes));
    }
}

package com.pathway.impact.api;

import com.pathway.impact.aggregate.ActivityProvider;
import com.pathway.impact.audit.AuditService;
import com.pathway.impact.cache.CacheConfig;
import com.pathway.impact.cache.CaffeineIdentityCache;
import com.pathway.impact.cache.IdentityCache;
import com.pathway.impact.cache.NoOpIdentityCache;
import com.pathway.impact.compare.CompareResult;
import com.pathway.impact.core.model.ResolutionOutcome;
import com.pathway.impact.error.ConfigurationException;
import com.pathway.impact.export.AnalysisExporter;
import com.pathway.impact.export.AnalysisJson;
import com.pathway.impact.export.CsvAnalysisExporter;
import com.pathway.impact.export.JsonAnalysisExporter;
import com.pathway.impact.health.HealthCheckRegistry;
import com.pathway.impact.health.HealthStatus;
import com.pathway.impact.health.HierarchySnapshotHealthCheck;
import com.pathway.impact.health.UpstreamHealthCheck;
import com.pathway.impact.hierarchy.EtlRunSummary;
import com.pathway.impact.hierarchy.HierarchyEtlRunner;
import com.pathway.impact.hierarchy.HierarchyRegistry;
import com.pathway.impact.hierarchy.HierarchySnapshot;
import com.pathway.impact.hierarchy.PathwaySource;
import com.pathway.impact.identity.IdentityProvider;
import com.pathway.impact.identity.IdentityResolver;
import com.pathway.impact.identity.StructureStandardizer;
import com.pathway.impact.jobs.AnalysisJobService;
import com.pathway.impact.jobs.JobConfig;
import com.pathway.impact.metrics.MetricsService;
import com.pathway.impact.metrics.NoOpMetricsService;
import com.pathway.impact.rules.DefaultNormalizationRules;
import com.pathway.impact.rules.NormalizationEngine;
import com.pathway.impact.snapshot.AnalysisRepository;
import com.pathway.impact.snapshot.InMemoryAnalysisRepository;
import com.pathway.impact.snapshot.InMemoryShareRepository;
import com.pathway.impact.snapshot.ShareManager;
import com.pathway.impact.snapshot.ShareRepository;
import com.pathway.impact.snapshot.ShareSnapshot;
import com.pathway.impact.tracing.NoOpTracingService;
import com.pathway.impact.tracing.TracingService;
import com.pathway.impact.upstream.RetryPolicy;
import com.pathway.impact.upstream.RetryingInvoker;
import com.pathway.impact.upstream.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Main entry point of the pathway impact library.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * PathwayImpactEngine engine = PathwayImpactEngine.builder()
 *     .identityProvider(chemblSearch)
 *     .activityProvider(chemblActivities)
 *     .pathwaySource(reactome)
 *     .build();
 *
 * engine.refreshHierarchy("full");
 * AnalysisResult result = engine.analyze("imatinib", AnalysisParams.defaults());
 * String csv = engine.export(result, "csv");
 * </pre>
 *
 * <p>Observability defaults to no-op implementations; metrics, tracing and caching are
 * switched on by passing the corresponding collaborator or configuration to the builder.</p>
 */
public class PathwayImpactEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PathwayImpactEngine.class);

    private final IdentityResolver identityResolver;
    private final AnalysisService analysisService;
    private final ShareManager shareManager;
    private final HierarchyRegistry hierarchyRegistry;
    private final HierarchyEtlRunner etlRunner;
    private final AuditService auditService;
    private final IdentityCache identityCache;
    private final Map<String, AnalysisExporter> exporters = new TreeMap<>();
    private final HealthCheckRegistry healthCheckRegistry;
    private final JobConfig jobConfig;
    private final Clock clock;
    private AnalysisJobService jobService;

    private PathwayImpactEngine(Builder builder) {
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService(clock);
        this.hierarchyRegistry = builder.hierarchyRegistry != null
                ? builder.hierarchyRegistry : new HierarchyRegistry();
        this.jobConfig = builder.jobConfig != null ? builder.jobConfig : JobConfig.defaults();

        RetryPolicy retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : RetryPolicy.defaults();
        Sleeper sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
        RetryingInvoker invoker = new RetryingInvoker(retryPolicy, sleeper, metricsService);

        NormalizationEngine normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();

        CacheConfig cacheConfig = builder.cacheConfig != null ? builder.cacheConfig : CacheConfig.defaults();
        this.identityCache = cacheConfig.enabled()
                ? new CaffeineIdentityCache(cacheConfig) : new NoOpIdentityCache();

        this.identityResolver = new IdentityResolver(builder.identityProvider, builder.structureStandardizer,
                normalizationEngine, identityCache, invoker, metricsService);

        AnalysisRepository analysisRepository = builder.analysisRepository != null
                ? builder.analysisRepository : new InMemoryAnalysisRepository();
        ShareRepository shareRepository = builder.shareRepository != null
                ? builder.shareRepository : new InMemoryShareRepository();

        this.analysisService = new AnalysisService(identityResolver, builder.activityProvider, hierarchyRegistry,
                analysisRepository, invoker, auditService, metricsService, tracingService, clock);

        AnalysisJson json = new AnalysisJson();
        this.shareManager = new ShareManager(analysisRepository, shareRepository, json, auditService, clock);
        registerExporter(new CsvAnalysisExporter(json));
        registerExporter(new JsonAnalysisExporter(json));

        this.etlRunner = builder.pathwaySource != null
                ? new HierarchyEtlRunner(builder.pathwaySource, hierarchyRegistry, invoker, auditService, clock)
                : null;

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new UpstreamHealthCheck(builder.activityProvider, true));
        healthCheckRegistry.register(new UpstreamHealthCheck(builder.identityProvider, false));
        if (builder.structureStandardizer != null) {
            healthCheckRegistry.register(new UpstreamHealthCheck(builder.structureStandardizer, false));
        }
        if (builder.pathwaySource != null) {
            healthCheckRegistry.register(new UpstreamHealthCheck(builder.pathwaySource, false));
        }
        healthCheckRegistry.register(new HierarchySnapshotHealthCheck(hierarchyRegistry));

        log.info("PathwayImpactEngine initialized: identity={} activity={} cache={}",
                builder.identityProvider.sourceName(), builder.activityProvider.sourceName(),
                cacheConfig.enabled() ? "caffeine" : "disabled");
    }

    // ========== Analysis API ==========

    public AnalysisResult analyze(String query, AnalysisParams params) {
        return analysisService.run(query, params);
    }

    /**
     * Runs an analysis, picking {@code resolutionChoice} among the candidates of an
     * ambiguous query.
     */
    public AnalysisResult analyze(String query, AnalysisParams params, String resolutionChoice) {
        return analysisService.run(query, params, resolutionChoice);
    }

    public AnalysisResult analyzeStructure(String structureText, AnalysisParams params) {
        return analysisService.runStructure(structureText, params);
    }

    public Optional<AnalysisResult> getAnalysis(String analysisId) {
        return analysisService.findAnalysis(analysisId);
    }

    public ResolutionOutcome resolve(String query) {
        return identityResolver.resolve(query);
    }

    public List<String> suggest(String prefix, int limit) {
        return identityResolver.suggest(prefix, limit);
    }

    // ========== Comparison API ==========

    public CompareResult compare(String queryA, String queryB, AnalysisParams params) {
        return analysisService.compare(queryA, queryB, params);
    }

    public CompareResult compareAnalyses(String analysisIdA, String analysisIdB) {
        return analysisService.compareStored(analysisIdA, analysisIdB);
    }

    // ========== Sharing & Export API ==========

    public ShareSnapshot share(String analysisId) {
        return shareManager.share(analysisId);
    }

    public Optional<AnalysisResult> readShare(String shareId) {
        return shareManager.read(shareId);
    }

    /**
     * Writes the analysis in the given format ({@code csv} or {@code json}).
     *
     * @return number of pathway rows written
     */
    public int export(AnalysisResult result, String format, Writer writer) throws IOException {
        return exporter(format).export(result, writer);
    }

    public String export(AnalysisResult result, String format) {
        return exporter(format).exportToString(result);
    }

    public void registerExporter(AnalysisExporter exporter) {
        exporters.put(exporter.getFormat(), exporter);
    }

    private AnalysisExporter exporter(String format) {
        AnalysisExporter exporter = format != null ? exporters.get(format) : null;
        if (exporter == null) {
            throw new ConfigurationException("Unsupported export format '" + format
                    + "', expected one of " + exporters.keySet());
        }
        return exporter;
    }

    // ========== Hierarchy API ==========

    /**
     * Pulls the pathway hierarchy from the configured source and publishes it.
     *
     * @throws ConfigurationException when the engine was built without a pathway source
     */
    public EtlRunSummary refreshHierarchy(String mode) {
        if (etlRunner == null) {
            throw new ConfigurationException("No pathway source is configured");
        }
        return etlRunner.run(mode);
    }

    /**
     * Publishes a snapshot built elsewhere, replacing the current one.
     */
    public void publishHierarchy(HierarchySnapshot snapshot) {
        hierarchyRegistry.publish(snapshot);
    }

    public Optional<HierarchySnapshot> currentHierarchy() {
        return hierarchyRegistry.current();
    }

    // ========== Jobs API ==========

    /**
     * Background job service, started on first use and stopped by {@link #close()}.
     */
    public synchronized AnalysisJobService jobs() {
        if (jobService == null) {
            jobService = new AnalysisJobService(analysisService, jobConfig, clock);
        }
        return jobService;
    }

    // ========== Health Check API ==========

    /**
     * Aggregate status of the upstream sources and the published hierarchy.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    // ========== Service Access ==========

    public AnalysisService getAnalysisService() {
        return analysisService;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public IdentityCache getIdentityCache() {
        return identityCache;
    }

    @Override
    public synchronized void close() {
        if (jobService != null) {
            jobService.close();
            jobService = null;
        }
        identityCache.invalidateAll();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IdentityProvider identityProvider;
        private ActivityProvider activityProvider;
        private StructureStandardizer structureStandardizer;
        private PathwaySource pathwaySource;
        private HierarchyRegistry hierarchyRegistry;
        private NormalizationEngine normalizationEngine;
        private CacheConfig cacheConfig;
        private RetryPolicy retryPolicy;
        private Sleeper sleeper;
        private JobConfig jobConfig;
        private AnalysisRepository analysisRepository;
        private ShareRepository shareRepository;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;

        /**
         * Sets the compound search service. Required.
         */
        public Builder identityProvider(IdentityProvider identityProvider) {
            this.identityProvider = identityProvider;
            return this;
        }

        /**
         * Sets the bioactivity source. Required.
         */
        public Builder activityProvider(ActivityProvider activityProvider) {
            this.activityProvider = activityProvider;
            return this;
        }

        /**
         * Enables structure search through the given standardizer.
         */
        public Builder structureStandardizer(StructureStandardizer structureStandardizer) {
            this.structureStandardizer = structureStandardizer;
            return this;
        }

        /**
         * Sets the source used by {@link PathwayImpactEngine#refreshHierarchy(String)}.
         */
        public Builder pathwaySource(PathwaySource pathwaySource) {
            this.pathwaySource = pathwaySource;
            return this;
        }

        /**
         * Shares a registry with other components, e.g. one already holding a snapshot.
         */
        public Builder hierarchyRegistry(HierarchyRegistry hierarchyRegistry) {
            this.hierarchyRegistry = hierarchyRegistry;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        /**
         * Sets the identity cache configuration. Defaults to {@link CacheConfig#defaults()}.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder jobConfig(JobConfig jobConfig) {
            this.jobConfig = jobConfig;
            return this;
        }

        public Builder analysisRepository(AnalysisRepository analysisRepository) {
            this.analysisRepository = analysisRepository;
            return this;
        }

        public Builder shareRepository(ShareRepository shareRepository) {
            this.shareRepository = shareRepository;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom tracing service for per-stage spans.
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PathwayImpactEngine build() {
            if (identityProvider == null) {
                throw new IllegalStateException("IdentityProvider is required");
            }
            if (activityProvider == null) {
                throw new IllegalStateException("ActivityProvider is required");
            }
            return new PathwayImpactEngine(this);
        }
    }
}

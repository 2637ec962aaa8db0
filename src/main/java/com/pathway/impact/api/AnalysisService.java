package com.pathway.impact.api;

import com.pathway.impact.aggregate.ActivityProvider;
import com.pathway.impact.aggregate.AggregationResult;
import com.pathway.impact.aggregate.TargetConfidenceAggregator;
import com.pathway.impact.audit.AuditAction;
import com.pathway.impact.audit.AuditService;
import com.pathway.impact.compare.CompareResult;
import com.pathway.impact.compare.ComparisonEngine;
import com.pathway.impact.core.model.ActivityRecord;
import com.pathway.impact.core.model.AnalysisFlags;
import com.pathway.impact.core.model.CompoundIdentity;
import com.pathway.impact.core.model.MappingStatus;
import com.pathway.impact.core.model.ResolutionOutcome;
import com.pathway.impact.core.model.ResolutionStatus;
import com.pathway.impact.core.model.TargetAnnotation;
import com.pathway.impact.core.model.TargetSummary;
import com.pathway.impact.core.model.TriState;
import com.pathway.impact.error.CompoundNotFoundException;
import com.pathway.impact.error.PathwayImpactException;
import com.pathway.impact.error.UpstreamUnavailableException;
import com.pathway.impact.error.ValidationException;
import com.pathway.impact.graph.AssociationGraph;
import com.pathway.impact.graph.AssociationGraphBuilder;
import com.pathway.impact.hierarchy.HierarchyRegistry;
import com.pathway.impact.hierarchy.HierarchySnapshot;
import com.pathway.impact.identity.IdentityResolver;
import com.pathway.impact.logging.LogContext;
import com.pathway.impact.metrics.MetricsService;
import com.pathway.impact.scoring.PathwayImpactScorer;
import com.pathway.impact.scoring.ScoringResult;
import com.pathway.impact.snapshot.AnalysisRepository;
import com.pathway.impact.snapshot.VersionSnapshot;
import com.pathway.impact.tracing.PipelineStage;
import com.pathway.impact.tracing.StageSpan;
import com.pathway.impact.tracing.TracingService;
import com.pathway.impact.upstream.RetryingInvoker;
import com.pathway.impact.upstream.UpstreamSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs the analysis pipeline for one compound:
 * resolve, fetch activities, aggregate, score, build the graph, snapshot and store.
 *
 * <p>Each run is synchronous and single-threaded and captures the hierarchy snapshot once.
 * Whole-run blockers (unknown compound, ambiguous query, activity source down) abort
 * with an exception. Everything else degrades: the run proceeds with partial data and
 * says so in {@code degradedMessages} and {@code analysisFlags}.</p>
 */
public class AnalysisService {
    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    public static final int LIMITED_DATA_MIN_TARGETS = 3;
    public static final int LIMITED_DATA_MIN_ASSAYS = 10;
    public static final double HIGH_VARIABILITY_IQR = 1.0;
    public static final int HIGH_VARIABILITY_MIN_ASSAYS = 3;

    static final String MSG_LIMITED_DATA = "Limited target data available for this compound.";
    static final String MSG_ANNOTATIONS = "Some target annotations may be incomplete.";
    static final String MSG_PARTIAL_MAPPING = "Some targets have limited pathway mapping coverage.";
    static final String MSG_NO_HIERARCHY = "Pathway data temporarily unavailable. Showing target binding data only.";
    static final String MSG_IDENTITY_CACHE = "Compound search unavailable; identity served from cache.";

    private final IdentityResolver identityResolver;
    private final ActivityProvider activityProvider;
    private final HierarchyRegistry hierarchyRegistry;
    private final TargetConfidenceAggregator aggregator;
    private final PathwayImpactScorer scorer;
    private final AssociationGraphBuilder graphBuilder;
    private final ComparisonEngine comparisonEngine;
    private final AnalysisRepository repository;
    private final RetryingInvoker invoker;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final Clock clock;

    public AnalysisService(IdentityResolver identityResolver,
                           ActivityProvider activityProvider,
                           HierarchyRegistry hierarchyRegistry,
                           AnalysisRepository repository,
                           RetryingInvoker invoker,
                           AuditService auditService,
                           MetricsService metrics,
                           TracingService tracing,
                           Clock clock) {
        this.identityResolver = identityResolver;
        this.activityProvider = activityProvider;
        this.hierarchyRegistry = hierarchyRegistry;
        this.repository = repository;
        this.invoker = invoker;
        this.auditService = auditService;
        this.metrics = metrics;
        this.tracing = tracing;
        this.clock = clock;
        this.aggregator = new TargetConfidenceAggregator();
        this.scorer = new PathwayImpactScorer();
        this.graphBuilder = new AssociationGraphBuilder();
        this.comparisonEngine = new ComparisonEngine();
    }

    public AnalysisResult run(String query, AnalysisParams params) {
        return run(query, params, null);
    }

    /**
     * Runs an analysis for a free-text compound query.
     *
     * @param resolutionChoice canonical id picked from a previous ambiguous outcome, or null
     * @throws ValidationException          for bad input or an ambiguous query (candidates attached)
     * @throws CompoundNotFoundException    when nothing matches the query
     * @throws UpstreamUnavailableException when the compound search or activity source is down
     */
    public AnalysisResult run(String query, AnalysisParams params, String resolutionChoice) {
        return execute(query, params, () -> identityResolver.resolve(query, resolutionChoice));
    }

    /**
     * Runs an analysis for a structure (SMILES or similar), including compounds the
     * search index does not know.
     */
    public AnalysisResult runStructure(String structureText, AnalysisParams params) {
        return execute(structureText, params, () -> identityResolver.resolveStructure(structureText));
    }

    /**
     * Runs both analyses with the same parameters and compares them.
     */
    public CompareResult compare(String queryA, String queryB, AnalysisParams params) {
        AnalysisResult a = run(queryA, params);
        AnalysisResult b = run(queryB, params);
        return compare(a, b);
    }

    /**
     * Compares two stored analyses.
     *
     * @throws ValidationException when either id is unknown
     */
    public CompareResult compareStored(String analysisIdA, String analysisIdB) {
        AnalysisResult a = findAnalysis(analysisIdA)
                .orElseThrow(() -> new ValidationException("Unknown analysis '" + analysisIdA + "'"));
        AnalysisResult b = findAnalysis(analysisIdB)
                .orElseThrow(() -> new ValidationException("Unknown analysis '" + analysisIdB + "'"));
        return compare(a, b);
    }

    public Optional<AnalysisResult> findAnalysis(String analysisId) {
        return repository.findById(analysisId);
    }

    private CompareResult compare(AnalysisResult a, AnalysisResult b) {
        try (LogContext ctx = LogContext.forComparison(a.analysisId(), b.analysisId())) {
            CompareResult result = comparisonEngine.compare(a, b);
            auditService.record(AuditAction.COMPARISON_COMPLETED, a.analysisId() + ":" + b.analysisId(), null,
                    Map.of("targetJaccard", result.metrics().targetJaccard(),
                            "sharedPathways", result.metrics().sharedPathwayCount()));
            log.info("comparison.completed jaccard={} cosine={}",
                    result.metrics().targetJaccard(), result.metrics().pathwayCosineSimilarity());
            return result;
        }
    }

    private AnalysisResult execute(String query, AnalysisParams params, Supplier<ResolutionOutcome> resolution) {
        String analysisId = LogContext.newId();
        Instant startedAt = clock.instant();
        try (LogContext ctx = LogContext.forAnalysis(analysisId, query)) {
            try {
                AnalysisResult result = pipeline(analysisId, startedAt, query, params, resolution);
                metrics.recordAnalysisDuration("succeeded", Duration.between(startedAt, clock.instant()));
                auditService.record(AuditAction.ANALYSIS_COMPLETED, analysisId, null, Map.of(
                        "compoundId", result.canonicalCompoundId(),
                        "targets", result.targets().size(),
                        "pathways", result.pathways().size()));
                log.info("analysis.completed compound={} targets={} pathways={} degraded={}",
                        result.canonicalCompoundId(), result.targets().size(), result.pathways().size(),
                        result.degradedMessages().size());
                return result;
            } catch (PathwayImpactException e) {
                metrics.recordAnalysisDuration("failed", Duration.between(startedAt, clock.instant()));
                auditService.record(AuditAction.ANALYSIS_FAILED, analysisId, null, Map.of(
                        "error", e.getClass().getSimpleName(),
                        "message", String.valueOf(e.getMessage())));
                log.warn("analysis.failed error={} message={}", e.getClass().getSimpleName(), e.getMessage());
                throw e;
            }
        }
    }

    private AnalysisResult pipeline(String analysisId, Instant createdAt, String query, AnalysisParams params,
                                    Supplier<ResolutionOutcome> resolution) {
        SortedSet<String> degraded = new TreeSet<>();

        Optional<HierarchySnapshot> published = hierarchyRegistry.current();
        if (published.isEmpty()) {
            degraded.add(MSG_NO_HIERARCHY);
            metrics.incrementDegraded("hierarchy");
        }
        HierarchySnapshot snapshot = published
                .orElseGet(() -> HierarchySnapshot.builder(VersionSnapshot.UNKNOWN).build());

        ResolutionOutcome outcome = stage(PipelineStage.RESOLVE, analysisId, () -> requireResolved(resolution.get()));
        CompoundIdentity compound = outcome.identity();
        if (outcome.fromCache()) {
            degraded.add(MSG_IDENTITY_CACHE);
            metrics.incrementDegraded("identity");
        }

        AggregationResult aggregation = stage(PipelineStage.AGGREGATE, analysisId, () -> {
            List<ActivityRecord> records = invoker.call(activityProvider.sourceName(),
                    () -> activityProvider.fetchActivities(compound.canonicalId()));
            Map<String, TargetAnnotation> annotations = fetchAnnotations(records, degraded);
            return aggregator.aggregate(compound.canonicalId(), records, annotations, snapshot::mapTarget, params);
        });
        degraded.addAll(aggregation.degradedMessages());
        List<TargetSummary> targets = aggregation.visible();

        ScoringResult scoring = stage(PipelineStage.SCORE, analysisId, () -> scorer.score(targets, snapshot, params));
        if (!scoring.integrityIssues().isEmpty()) {
            degraded.add(scoring.integrityIssues().size() + " pathway(s) skipped due to inconsistent reference data.");
        }

        AssociationGraph graph = stage(PipelineStage.GRAPH, analysisId,
                () -> graphBuilder.build(compound, targets, scoring.pathways()));

        AnalysisFlags flags = flags(aggregation, scoring);
        if (flags.limitedData().isPositive()) {
            degraded.add(MSG_LIMITED_DATA);
        }
        if (flags.partialMapping().isPositive() && published.isPresent()) {
            degraded.add(MSG_PARTIAL_MAPPING);
        }

        return stage(PipelineStage.SNAPSHOT, analysisId, () -> {
            VersionSnapshot versions = VersionSnapshot.builder()
                    .record(identityResolver.getProvider().sourceName(), versionOf(identityResolver.getProvider()))
                    .record(activityProvider.sourceName(), versionOf(activityProvider))
                    .record(HierarchyRegistry.SOURCE_NAME, snapshot.releaseTag())
                    .build();
            AnalysisResult result = AnalysisResult.builder()
                    .analysisId(analysisId)
                    .createdAt(createdAt)
                    .query(query)
                    .params(params)
                    .resolution(outcome)
                    .targets(targets)
                    .excludedLowConfidenceTargetIds(aggregation.excludedLowConfidenceTargetIds())
                    .pathways(scoring.pathways())
                    .graph(graph)
                    .versionSnapshot(versions)
                    .analysisFlags(flags)
                    .degradedMessages(new ArrayList<>(degraded))
                    .build();
            metrics.recordTargetCount(targets.size());
            metrics.recordPathwayCount(scoring.pathways().size());
            return repository.save(result);
        });
    }

    private ResolutionOutcome requireResolved(ResolutionOutcome outcome) {
        if (outcome.status() == ResolutionStatus.AMBIGUOUS) {
            throw new ValidationException("Compound query '" + outcome.query()
                    + "' is ambiguous; choose one of the candidates", outcome.candidates());
        }
        if (outcome.status() == ResolutionStatus.NOT_FOUND) {
            throw new CompoundNotFoundException(outcome.query());
        }
        return outcome;
    }

    private Map<String, TargetAnnotation> fetchAnnotations(List<ActivityRecord> records, SortedSet<String> degraded) {
        SortedSet<String> targetIds = records.stream()
                .map(ActivityRecord::targetId)
                .filter(id -> id != null && !id.isBlank())
                .collect(Collectors.toCollection(TreeSet::new));
        if (targetIds.isEmpty()) {
            return Map.of();
        }
        try {
            return invoker.call(activityProvider.sourceName(),
                    () -> activityProvider.fetchTargetAnnotations(targetIds));
        } catch (UpstreamUnavailableException e) {
            log.warn("analysis.annotations_unavailable targets={} error={}", targetIds.size(), e.getMessage());
            degraded.add(MSG_ANNOTATIONS);
            metrics.incrementDegraded("annotations");
            return Map.of();
        }
    }

    static AnalysisFlags flags(AggregationResult aggregation, ScoringResult scoring) {
        List<TargetSummary> targets = aggregation.visible();
        boolean limited = targets.size() < LIMITED_DATA_MIN_TARGETS
                || aggregation.totalVisibleAssays() < LIMITED_DATA_MIN_ASSAYS;

        TriState partialMapping;
        if (targets.isEmpty()) {
            partialMapping = TriState.UNKNOWN;
        } else {
            boolean anyNotMapped = targets.stream().anyMatch(t -> t.mappingStatus() != MappingStatus.MAPPED);
            partialMapping = TriState.of(anyNotMapped || scoring.isEmpty());
        }

        List<TargetSummary> sampled = targets.stream()
                .filter(t -> t.assayCount() >= HIGH_VARIABILITY_MIN_ASSAYS)
                .toList();
        TriState highVariability = sampled.isEmpty()
                ? TriState.UNKNOWN
                : TriState.of(sampled.stream().anyMatch(t -> t.potencyIqr() >= HIGH_VARIABILITY_IQR));

        return new AnalysisFlags(TriState.of(limited), partialMapping, highVariability);
    }

    private <T> T stage(PipelineStage stage, String analysisId, Supplier<T> work) {
        try (StageSpan span = tracing.startStage(stage, analysisId)) {
            try {
                return work.get();
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private static Optional<String> versionOf(UpstreamSource source) {
        try {
            return source.sourceVersion();
        } catch (UpstreamUnavailableException e) {
            log.debug("Version of {} unavailable: {}", source.sourceName(), e.getMessage());
            return Optional.empty();
        }
    }
}

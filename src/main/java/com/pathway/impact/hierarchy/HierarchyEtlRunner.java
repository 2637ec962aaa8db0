package com.pathway.impact.hierarchy;

import com.pathway.impact.audit.AuditAction;
import com.pathway.impact.audit.AuditService;
import com.pathway.impact.error.UpstreamUnavailableException;
import com.pathway.impact.logging.LogContext;
import com.pathway.impact.upstream.RetryingInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Entry point the external scheduler calls to rebuild the pathway hierarchy.
 * Pulls raw data, collapses it, and publishes the snapshot atomically. A failed run
 * leaves the previously published snapshot in place.
 */
public class HierarchyEtlRunner {
    private static final Logger log = LoggerFactory.getLogger(HierarchyEtlRunner.class);

    private static final int MAX_REPORTED_ISSUES = 100;

    private final PathwaySource source;
    private final HierarchyRegistry registry;
    private final RetryingInvoker invoker;
    private final AuditService auditService;
    private final Clock clock;

    public HierarchyEtlRunner(PathwaySource source, HierarchyRegistry registry, RetryingInvoker invoker,
                              AuditService auditService, Clock clock) {
        this.source = source;
        this.registry = registry;
        this.invoker = invoker;
        this.auditService = auditService;
        this.clock = clock;
    }

    public EtlRunSummary run(String mode) {
        String runId = LogContext.newId();
        Instant startedAt = clock.instant();
        try (LogContext ctx = LogContext.forEtl(runId).with("mode", mode)) {
            RawHierarchy raw;
            try {
                raw = invoker.call(source.sourceName(), source::fetchHierarchy);
            } catch (UpstreamUnavailableException e) {
                log.error("etl.failed runId={} error={}", runId, e.getMessage(), e);
                return new EtlRunSummary(runId, EtlRunSummary.Status.FAILED, mode, 0, 0, 0, List.of(),
                        null, false, e.getMessage(), startedAt, clock.instant());
            }

            String release = releaseVersion();
            HierarchySnapshotBuilder builder = HierarchySnapshot.builder(release);
            for (RawHierarchy.RawPathway pathway : raw.pathways()) {
                builder.addPathway(pathway.id(), pathway.name(), pathway.geneSetSize(), pathway.geneProductIds());
            }
            for (RawHierarchy.Relation relation : raw.relations()) {
                builder.addRelation(relation.parentId(), relation.childId());
            }
            for (Map.Entry<String, String> alias : raw.geneSymbolAliases().entrySet()) {
                builder.addGeneSymbolAlias(alias.getKey(), alias.getValue());
            }
            HierarchySnapshot snapshot = builder.build();
            registry.publish(snapshot);

            List<String> issues = snapshot.integrityIssues().stream()
                    .limit(MAX_REPORTED_ISSUES)
                    .map(DataIntegrityIssue::describe)
                    .toList();
            auditService.record(AuditAction.HIERARCHY_PUBLISHED, release, null, Map.of(
                    "runId", runId,
                    "pathways", snapshot.size(),
                    "integrityIssues", snapshot.integrityIssues().size()));
            log.info("etl.completed runId={} release={} pathways={}/{} issues={}",
                    runId, release, snapshot.size(), raw.pathways().size(), snapshot.integrityIssues().size());
            return new EtlRunSummary(runId, EtlRunSummary.Status.COMPLETED, mode, raw.pathways().size(),
                    snapshot.size(), raw.relations().size(), issues, release, true, null,
                    startedAt, clock.instant());
        }
    }

    private String releaseVersion() {
        try {
            String version = invoker.call(source.sourceName(), source::fetchReleaseVersion);
            if (version != null && !version.isBlank()) {
                return version;
            }
        } catch (UpstreamUnavailableException e) {
            log.warn("etl.release_unavailable error={}", e.getMessage());
        }
        return "unknown-" + LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}

package com.pathway.impact.api;

import com.pathway.impact.core.model.AnalysisFlags;
import com.pathway.impact.core.model.PathwayScore;
import com.pathway.impact.core.model.ResolutionOutcome;
import com.pathway.impact.core.model.TargetSummary;
import com.pathway.impact.graph.AssociationGraph;
import com.pathway.impact.snapshot.VersionSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything one analysis run produced. Immutable; a re-run produces a new result with
 * a new id.
 *
 * @param targets                        targets shown under {@code params}
 * @param excludedLowConfidenceTargetIds low-confidence targets hidden because
 *                                       {@code includeLowConfidence} was off
 * @param degradedMessages               sorted, de-duplicated notes about partial data
 */
public record AnalysisResult(
        String analysisId,
        Instant createdAt,
        String query,
        AnalysisParams params,
        ResolutionOutcome resolution,
        List<TargetSummary> targets,
        List<String> excludedLowConfidenceTargetIds,
        List<PathwayScore> pathways,
        AssociationGraph graph,
        VersionSnapshot versionSnapshot,
        AnalysisFlags analysisFlags,
        List<String> degradedMessages,
        String attribution
) {
    public static final String ATTRIBUTION = "Data sources: ChEMBL (CC BY-SA 3.0, EMBL-EBI), Reactome (CC0), "
            + "UniProt (CC BY 4.0), OpenTargets (Open Access), PubChem (Public Domain).";

    public AnalysisResult {
        Objects.requireNonNull(analysisId, "analysisId is required");
        Objects.requireNonNull(createdAt, "createdAt is required");
        Objects.requireNonNull(params, "params is required");
        Objects.requireNonNull(resolution, "resolution is required");
        targets = targets != null ? List.copyOf(targets) : List.of();
        excludedLowConfidenceTargetIds = excludedLowConfidenceTargetIds != null
                ? List.copyOf(excludedLowConfidenceTargetIds) : List.of();
        pathways = pathways != null ? List.copyOf(pathways) : List.of();
        graph = graph != null ? graph : AssociationGraph.empty();
        versionSnapshot = versionSnapshot != null ? versionSnapshot : VersionSnapshot.builder().build();
        analysisFlags = analysisFlags != null ? analysisFlags : AnalysisFlags.unknown();
        degradedMessages = degradedMessages != null ? List.copyOf(degradedMessages) : List.of();
        attribution = attribution != null ? attribution : ATTRIBUTION;
    }

    public String canonicalCompoundId() {
        return resolution.identity() != null ? resolution.identity().canonicalId() : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String analysisId;
        private Instant createdAt;
        private String query;
        private AnalysisParams params;
        private ResolutionOutcome resolution;
        private List<TargetSummary> targets;
        private List<String> excludedLowConfidenceTargetIds;
        private List<PathwayScore> pathways;
        private AssociationGraph graph;
        private VersionSnapshot versionSnapshot;
        private AnalysisFlags analysisFlags;
        private List<String> degradedMessages;
        private String attribution = ATTRIBUTION;

        public Builder analysisId(String analysisId) {
            this.analysisId = analysisId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder params(AnalysisParams params) {
            this.params = params;
            return this;
        }

        public Builder resolution(ResolutionOutcome resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder targets(List<TargetSummary> targets) {
            this.targets = targets;
            return this;
        }

        public Builder excludedLowConfidenceTargetIds(List<String> ids) {
            this.excludedLowConfidenceTargetIds = ids;
            return this;
        }

        public Builder pathways(List<PathwayScore> pathways) {
            this.pathways = pathways;
            return this;
        }

        public Builder graph(AssociationGraph graph) {
            this.graph = graph;
            return this;
        }

        public Builder versionSnapshot(VersionSnapshot versionSnapshot) {
            this.versionSnapshot = versionSnapshot;
            return this;
        }

        public Builder analysisFlags(AnalysisFlags analysisFlags) {
            this.analysisFlags = analysisFlags;
            return this;
        }

        public Builder degradedMessages(List<String> degradedMessages) {
            this.degradedMessages = degradedMessages;
            return this;
        }

        public Builder attribution(String attribution) {
            this.attribution = attribution;
            return this;
        }

        public AnalysisResult build() {
            return new AnalysisResult(analysisId, createdAt, query, params, resolution, targets,
                    excludedLowConfidenceTargetIds, pathways, graph, versionSnapshot, analysisFlags,
                    degradedMessages, attribution);
        }
    }
}

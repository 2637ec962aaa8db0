package com.pathway.impact.scoring;

import com.pathway.impact.aggregate.PotencyStatistics;
import com.pathway.impact.aggregate.TargetConfidenceAggregator;
import com.pathway.impact.api.AnalysisParams;
import com.pathway.impact.core.model.PathwayNode;
import com.pathway.impact.core.model.PathwayScore;
import com.pathway.impact.core.model.TargetSummary;
import com.pathway.impact.error.DataIntegrityException;
import com.pathway.impact.hierarchy.DataIntegrityIssue;
import com.pathway.impact.hierarchy.HierarchySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Propagates target hits into per-pathway impact scores.
 *
 * <pre>
 * score = (targetsHit / pathwaySize) * median(potency of hit targets)
 * </pre>
 *
 * <p>Umbrella pathways (depth 1) and pathways outside the configured depth band are
 * dropped. When a pathway and one of its retained ancestors are hit by exactly the same
 * targets, only the deeper pathway is shown and the ancestor is recorded on it as
 * absorbed. Ranking: score desc, coverage desc, pathway id asc.</p>
 */
public class PathwayImpactScorer {
    private static final Logger log = LoggerFactory.getLogger(PathwayImpactScorer.class);

    public ScoringResult score(List<TargetSummary> targets, HierarchySnapshot snapshot, AnalysisParams params) {
        SortedMap<String, SortedMap<String, TargetSummary>> hitsByPathway = collectHits(targets, snapshot);

        List<DataIntegrityIssue> issues = new ArrayList<>();
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (Map.Entry<String, SortedMap<String, TargetSummary>> entry : hitsByPathway.entrySet()) {
            String pathwayId = entry.getKey();
            try {
                PathwayNode node = snapshot.node(pathwayId).orElseThrow(() ->
                        new DataIntegrityException(pathwayId, "pathway missing from hierarchy"));
                if (node.geneSetSize() <= 0) {
                    throw new DataIntegrityException(pathwayId, "pathway size is zero");
                }
                if (!inDepthBand(node.depth(), params)) {
                    continue;
                }
                candidates.put(pathwayId, new Candidate(node, entry.getValue()));
            } catch (DataIntegrityException e) {
                log.warn("score.skipped pathway={} reason={}", e.getEntityId(), e.getMessage());
                issues.add(DataIntegrityIssue.from(e));
            }
        }

        Set<String> removed = new TreeSet<>();
        Map<String, List<String>> absorbed = absorbAncestors(candidates, removed);

        List<PathwayScore> scores = new ArrayList<>();
        for (Candidate candidate : candidates.values()) {
            if (!removed.contains(candidate.node.id())) {
                scores.add(toScore(candidate, absorbed.getOrDefault(candidate.node.id(), List.of())));
            }
        }
        scores.sort(PathwayScore.DISPLAY_ORDER);
        List<PathwayScore> top = scores.size() > params.topPathways()
                ? scores.subList(0, params.topPathways())
                : scores;

        log.debug("score.completed targets={} pathwaysHit={} inBand={} shown={} issues={}",
                targets.size(), hitsByPathway.size(), candidates.size(), top.size(), issues.size());
        return new ScoringResult(top, issues, hitsByPathway.size(), candidates.size());
    }

    static boolean inDepthBand(int depth, AnalysisParams params) {
        return depth > 1 && depth >= params.minDepth() && depth <= params.maxDepth();
    }

    private SortedMap<String, SortedMap<String, TargetSummary>> collectHits(List<TargetSummary> targets,
                                                                           HierarchySnapshot snapshot) {
        SortedMap<String, SortedMap<String, TargetSummary>> hits = new TreeMap<>();
        for (TargetSummary target : targets) {
            if (!target.mappingStatus().isScorable() || target.geneProductId() == null) {
                continue;
            }
            for (String pathwayId : snapshot.pathwaysContaining(target.geneProductId())) {
                hits.computeIfAbsent(pathwayId, k -> new TreeMap<>()).put(target.targetId(), target);
            }
        }
        return hits;
    }

    /**
     * Returns, per pathway, the retained ancestors hit by exactly the same targets, and adds
     * every such ancestor to {@code removed}. In a chain of identical hit sets only the
     * deepest pathway survives and carries all of them.
     */
    private Map<String, List<String>> absorbAncestors(Map<String, Candidate> candidates, Set<String> removed) {
        Map<String, List<String>> absorbedBy = new HashMap<>();
        for (Candidate candidate : candidates.values()) {
            Set<String> targetIds = candidate.hits.keySet();
            List<String> absorbed = new ArrayList<>();
            for (String ancestorId : new TreeSet<>(candidate.node.ancestorIds())) {
                Candidate ancestor = candidates.get(ancestorId);
                if (ancestor != null && ancestor.hits.keySet().equals(targetIds)) {
                    absorbed.add(ancestorId);
                    removed.add(ancestorId);
                }
            }
            if (!absorbed.isEmpty()) {
                absorbedBy.put(candidate.node.id(), absorbed);
            }
        }
        return absorbedBy;
    }

    private PathwayScore toScore(Candidate candidate, List<String> absorbed) {
        List<TargetSummary> hitTargets = new ArrayList<>(candidate.hits.values());
        // strongest first, ties by id; the median itself is order independent
        hitTargets.sort(TargetConfidenceAggregator.POTENCY_ORDER);
        List<Double> potencies = hitTargets.stream().map(TargetSummary::medianPotency).toList();

        int size = candidate.node.geneSetSize();
        int hit = hitTargets.size();
        double median = PotencyStatistics.median(potencies);
        double coverage = (double) hit / size;

        return new PathwayScore(
                candidate.node.id(),
                candidate.node.name(),
                candidate.node.depth(),
                size,
                hit,
                median,
                PotencyStatistics.round6(coverage * median),
                PotencyStatistics.round6(coverage),
                new ArrayList<>(candidate.hits.keySet()),
                new ArrayList<>(new TreeSet<>(candidate.node.ancestorIds())),
                absorbed);
    }

    private static final class Candidate {
        private final PathwayNode node;
        private final SortedMap<String, TargetSummary> hits;

        private Candidate(PathwayNode node, SortedMap<String, TargetSummary> hits) {
            this.node = node;
            this.hits = hits;
        }
    }
}

package com.pathway.impact.compare;

import com.pathway.impact.aggregate.PotencyStatistics;
import com.pathway.impact.api.AnalysisResult;
import com.pathway.impact.core.model.PathwayScore;
import com.pathway.impact.core.model.TargetSummary;
import com.pathway.impact.error.ConfigurationException;
import com.pathway.impact.similarity.CosineSimilarity;
import com.pathway.impact.similarity.JaccardSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Compares two completed analyses run with the same parameters.
 *
 * <p>Targets are compared as sets of displayed target ids (Jaccard). Pathways are
 * compared as score vectors over the union of displayed pathway ids, where a pathway
 * missing from one analysis scores 0: dropping out of the top-N is a scoring outcome,
 * not missing data.</p>
 */
public class ComparisonEngine {
    private static final Logger log = LoggerFactory.getLogger(ComparisonEngine.class);

    private final JaccardSimilarity jaccard = new JaccardSimilarity();
    private final CosineSimilarity cosine = new CosineSimilarity();

    /**
     * @throws ConfigurationException when the analyses were run with different parameters
     */
    public CompareResult compare(AnalysisResult a, AnalysisResult b) {
        if (!a.params().equals(b.params())) {
            throw new ConfigurationException("Analyses " + a.analysisId() + " and " + b.analysisId()
                    + " were run with different parameters: " + a.params() + " vs " + b.params());
        }

        Set<String> targetsA = targetIds(a);
        Set<String> targetsB = targetIds(b);
        Map<String, PathwayScore> pathwaysA = byId(a.pathways());
        Map<String, PathwayScore> pathwaysB = byId(b.pathways());

        Set<String> union = new TreeSet<>(pathwaysA.keySet());
        union.addAll(pathwaysB.keySet());
        List<PathwayComparisonRow> rows = new ArrayList<>();
        int shared = 0;
        for (String pathwayId : union) {
            PathwayScore scoreA = pathwaysA.get(pathwayId);
            PathwayScore scoreB = pathwaysB.get(pathwayId);
            boolean inBoth = scoreA != null && scoreB != null;
            if (inBoth) {
                shared++;
            }
            rows.add(new PathwayComparisonRow(
                    pathwayId,
                    scoreA != null ? scoreA.pathwayName() : scoreB.pathwayName(),
                    scoreA != null ? scoreA.score() : null,
                    scoreB != null ? scoreB.score() : null,
                    inBoth ? PotencyStatistics.round6(scoreA.score() - scoreB.score()) : null,
                    inBoth));
        }
        rows.sort(PathwayComparisonRow.ORDER);

        CompareMetrics metrics = new CompareMetrics(
                PotencyStatistics.round6(jaccard.compute(targetsA, targetsB)),
                PotencyStatistics.round6(cosine.compute(scores(pathwaysA), scores(pathwaysB))),
                shared,
                pathwaysA.size() - shared,
                pathwaysB.size() - shared);

        log.debug("compare.completed a={} b={} jaccard={} cosine={} shared={}",
                a.analysisId(), b.analysisId(), metrics.targetJaccard(),
                metrics.pathwayCosineSimilarity(), shared);
        return new CompareResult(a, b, rows, metrics);
    }

    private static Set<String> targetIds(AnalysisResult result) {
        return result.targets().stream().map(TargetSummary::targetId).collect(Collectors.toCollection(TreeSet::new));
    }

    private static Map<String, PathwayScore> byId(List<PathwayScore> pathways) {
        Map<String, PathwayScore> map = new LinkedHashMap<>();
        for (PathwayScore pathway : pathways) {
            map.put(pathway.pathwayId(), pathway);
        }
        return map;
    }

    private static Map<String, Double> scores(Map<String, PathwayScore> pathways) {
        Map<String, Double> scores = new LinkedHashMap<>();
        pathways.forEach((id, pathway) -> scores.put(id, pathway.score()));
        return scores;
    }
}

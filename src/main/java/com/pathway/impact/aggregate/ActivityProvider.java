package com.pathway.impact.aggregate;

import com.pathway.impact.core.model.ActivityRecord;
import com.pathway.impact.core.model.TargetAnnotation;
import com.pathway.impact.upstream.UpstreamSource;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Bioactivity database (ChEMBL-like). Records are returned as delivered; filtering is
 * the aggregator's job.
 */
public interface ActivityProvider extends UpstreamSource {

    List<ActivityRecord> fetchActivities(String canonicalCompoundId);

    /**
     * Returns details for as many of the given targets as the source knows. Targets missing
     * from the result are treated as unannotated.
     */
    Map<String, TargetAnnotation> fetchTargetAnnotations(Collection<String> targetIds);
}

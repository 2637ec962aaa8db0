package com.pathway.impact.aggregate;

import com.pathway.impact.core.model.TargetSummary;

import java.util.List;

/**
 * Output of {@link TargetConfidenceAggregator}.
 *
 * @param summaries                       every target with at least one accepted record
 * @param visible                         targets shown and scored under the current parameters
 * @param excludedLowConfidenceTargetIds  low-confidence targets hidden from {@code visible}
 * @param degradedMessages                user-facing notes about truncation
 * @param acceptedRecords                 records that passed the relation and validity filter
 */
public record AggregationResult(
        List<TargetSummary> summaries,
        List<TargetSummary> visible,
        List<String> excludedLowConfidenceTargetIds,
        List<String> degradedMessages,
        int acceptedRecords
) {
    public AggregationResult {
        summaries = List.copyOf(summaries);
        visible = List.copyOf(visible);
        excludedLowConfidenceTargetIds = List.copyOf(excludedLowConfidenceTargetIds);
        degradedMessages = List.copyOf(degradedMessages);
    }

    public int totalVisibleAssays() {
        return visible.stream().mapToInt(TargetSummary::assayCount).sum();
    }
}

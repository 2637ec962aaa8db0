package com.pathway.impact.hierarchy;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one hierarchy ETL run.
 *
 * @param published true when the built snapshot replaced the previous one
 * @param error     failure message, or null when the run completed
 */
public record EtlRunSummary(
        String runId,
        Status status,
        String mode,
        int pathwaysTotal,
        int pathwaysPublished,
        int relationsTotal,
        List<String> integrityIssues,
        String releaseVersion,
        boolean published,
        String error,
        Instant startedAt,
        Instant finishedAt
) {
    public enum Status { COMPLETED, FAILED }

    public EtlRunSummary {
        integrityIssues = integrityIssues != null ? List.copyOf(integrityIssues) : List.of();
    }
}

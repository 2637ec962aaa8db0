package com.pathway.impact.jobs;

import java.time.Instant;

/**
 * Point-in-time view of a background analysis.
 *
 * @param analysisId set once the job has SUCCEEDED
 * @param error      set once the job has FAILED
 */
public record JobSnapshot(
        String jobId,
        String query,
        JobState state,
        String analysisId,
        String error,
        Instant submittedAt,
        Instant startedAt,
        Instant finishedAt
) {
}

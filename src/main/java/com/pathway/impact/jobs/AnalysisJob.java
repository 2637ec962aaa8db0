package com.pathway.impact.jobs;

import java.time.Instant;
import java.util.concurrent.Future;

/**
 * Mutable job record owned by {@link AnalysisJobService}. State moves forward only:
 * once a terminal state is reached every later transition is ignored.
 */
final class AnalysisJob {

    private final String jobId;
    private final String query;
    private final Instant submittedAt;

    private JobState state = JobState.QUEUED;
    private String analysisId;
    private String error;
    private Instant startedAt;
    private Instant finishedAt;
    private Future<?> future;

    AnalysisJob(String jobId, String query, Instant submittedAt) {
        this.jobId = jobId;
        this.query = query;
        this.submittedAt = submittedAt;
    }

    String jobId() {
        return jobId;
    }

    synchronized boolean start(Instant now) {
        if (state != JobState.QUEUED) {
            return false;
        }
        state = JobState.RUNNING;
        startedAt = now;
        return true;
    }

    synchronized boolean succeed(String analysisId, Instant now) {
        if (state.isTerminal()) {
            return false;
        }
        this.state = JobState.SUCCEEDED;
        this.analysisId = analysisId;
        this.finishedAt = now;
        return true;
    }

    synchronized boolean fail(String error, Instant now) {
        if (state.isTerminal()) {
            return false;
        }
        this.state = JobState.FAILED;
        this.error = error;
        this.finishedAt = now;
        return true;
    }

    synchronized boolean cancel(Instant now) {
        if (state.isTerminal()) {
            return false;
        }
        this.state = JobState.CANCELED;
        this.finishedAt = now;
        interrupt();
        return true;
    }

    synchronized boolean timeOut(String error, Instant now) {
        if (!fail(error, now)) {
            return false;
        }
        interrupt();
        return true;
    }

    private void interrupt() {
        if (future != null) {
            future.cancel(true);
        }
    }

    synchronized void attach(Future<?> future) {
        this.future = future;
    }

    synchronized JobSnapshot snapshot() {
        return new JobSnapshot(jobId, query, state, analysisId, error, submittedAt, startedAt, finishedAt);
    }
}

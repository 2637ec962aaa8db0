package com.pathway.impact.jobs;

import com.pathway.impact.api.AnalysisParams;
import com.pathway.impact.api.AnalysisResult;
import com.pathway.impact.api.AnalysisService;
import com.pathway.impact.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs analyses in the background on a fixed worker pool.
 *
 * <p>Jobs move {@code QUEUED -> RUNNING -> SUCCEEDED | FAILED}, or to {@code CANCELED} from
 * either non-terminal state. A job still running when its timeout elapses is marked FAILED
 * and its worker is interrupted; a result arriving after that is discarded. Jobs in a terminal
 * state are dropped once {@link JobConfig#retention()} has passed since they finished.</p>
 */
public class AnalysisJobService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AnalysisJobService.class);

    private final AnalysisService analysisService;
    private final JobConfig config;
    private final Clock clock;
    private final ExecutorService executor;
    private final Map<String, AnalysisJob> jobs = new ConcurrentHashMap<>();

    public AnalysisJobService(AnalysisService analysisService, JobConfig config, Clock clock) {
        this.analysisService = analysisService;
        this.config = config;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());
    }

    /**
     * Queues an analysis and returns its job id immediately.
     */
    public String submit(String query, AnalysisParams params) {
        return submit(query, params, null);
    }

    public String submit(String query, AnalysisParams params, String resolutionChoice) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Query is required");
        }
        purgeExpired();
        AnalysisJob job = new AnalysisJob(UUID.randomUUID().toString(), query, clock.instant());
        jobs.put(job.jobId(), job);
        Future<?> future = executor.submit(() -> execute(job, query, params, resolutionChoice));
        job.attach(future);
        log.info("job.submitted jobId={} query='{}'", job.jobId(), query);
        return job.jobId();
    }

    public Optional<JobSnapshot> status(String jobId) {
        AnalysisJob job = jobs.get(jobId);
        return job != null ? Optional.of(job.snapshot()) : Optional.empty();
    }

    /**
     * @return true when the job was queued or running and is now CANCELED
     */
    public boolean cancel(String jobId) {
        AnalysisJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        boolean canceled = job.cancel(clock.instant());
        if (canceled) {
            log.info("job.canceled jobId={}", jobId);
        }
        return canceled;
    }

    public int size() {
        purgeExpired();
        return jobs.size();
    }

    /**
     * Removes terminal jobs whose retention has elapsed.
     *
     * @return number of jobs removed
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(config.retention());
        int removed = 0;
        for (Map.Entry<String, AnalysisJob> entry : jobs.entrySet()) {
            JobSnapshot snapshot = entry.getValue().snapshot();
            if (snapshot.state().isTerminal() && !snapshot.finishedAt().isAfter(cutoff)
                    && jobs.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("job.purged removed={} remaining={}", removed, jobs.size());
        }
        return removed;
    }

    private void execute(AnalysisJob job, String query, AnalysisParams params, String resolutionChoice) {
        if (!job.start(clock.instant())) {
            return;
        }
        long timeoutMs = config.timeout().toMillis();
        CompletableFuture.runAsync(() -> {
            if (job.timeOut("timed out after " + timeoutMs + " ms", clock.instant())) {
                log.warn("job.timed_out jobId={} timeoutMs={}", job.jobId(), timeoutMs);
            }
        }, CompletableFuture.delayedExecutor(timeoutMs, TimeUnit.MILLISECONDS));

        try {
            AnalysisResult result = analysisService.run(query, params, resolutionChoice);
            if (job.succeed(result.analysisId(), clock.instant())) {
                log.info("job.succeeded jobId={} analysisId={}", job.jobId(), result.analysisId());
            }
        } catch (RuntimeException e) {
            if (job.fail(e.getMessage(), clock.instant())) {
                log.warn("job.failed jobId={} error={}", job.jobId(), e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pathway-impact-job-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

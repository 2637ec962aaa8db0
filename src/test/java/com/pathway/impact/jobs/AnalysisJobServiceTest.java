package com.pathway.impact.jobs;

import com.pathway.impact.api.AnalysisParams;
import com.pathway.impact.api.AnalysisResult;
import com.pathway.impact.api.AnalysisService;
import com.pathway.impact.error.CompoundNotFoundException;
import com.pathway.impact.error.ConfigurationException;
import com.pathway.impact.error.UpstreamUnavailableException;
import com.pathway.impact.error.ValidationException;
import com.pathway.impact.fixtures.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("AnalysisJobService Tests")
class AnalysisJobServiceTest {

    private final CountDownLatch release = new CountDownLatch(1);
    private AnalysisService analysisService;
    private AnalysisJobService jobs;

    @BeforeEach
    void setUp() {
        analysisService = mock(AnalysisService.class);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        if (jobs != null) {
            jobs.close();
        }
    }

    private AnalysisJobService start(JobConfig config) {
        jobs = new AnalysisJobService(analysisService, config, Clock.systemUTC());
        return jobs;
    }

    private JobSnapshot awaitTerminal(String jobId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            JobSnapshot snapshot = jobs.status(jobId).orElseThrow();
            if (snapshot.state().isTerminal()) {
                return snapshot;
            }
            Thread.sleep(10);
        }
        return fail("job " + jobId + " did not finish");
    }

    private void blockUntilReleased() {
        when(analysisService.run(eq("erlotinib"), any(), any())).thenAnswer(invocation -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpstreamUnavailableException("chembl", "interrupted", false, e);
            }
            return Fixtures.result("a-blocked", Fixtures.ERLOTINIB, List.of(), List.of(), AnalysisParams.defaults());
        });
    }

    @Test
    @DisplayName("Successful job ends SUCCEEDED with the analysis id")
    void succeeds() throws InterruptedException {
        AnalysisResult result = Fixtures.result("a-1", Fixtures.ERLOTINIB, List.of(), List.of(),
                AnalysisParams.defaults());
        when(analysisService.run(eq("erlotinib"), any(), any())).thenReturn(result);
        start(JobConfig.defaults());

        String jobId = jobs.submit("erlotinib", AnalysisParams.defaults());
        JobSnapshot snapshot = awaitTerminal(jobId);

        assertEquals(JobState.SUCCEEDED, snapshot.state());
        assertEquals("a-1", snapshot.analysisId());
        assertNull(snapshot.error());
        assertNotNull(snapshot.startedAt());
        assertFalse(snapshot.finishedAt().isBefore(snapshot.submittedAt()));
    }

    @Test
    @DisplayName("Failing analysis ends FAILED with the error")
    void fails() throws InterruptedException {
        when(analysisService.run(anyString(), any(), any())).thenThrow(new CompoundNotFoundException("paracetamol"));
        start(JobConfig.defaults());

        JobSnapshot snapshot = awaitTerminal(jobs.submit("paracetamol", AnalysisParams.defaults()));

        assertEquals(JobState.FAILED, snapshot.state());
        assertNotNull(snapshot.error());
        assertNull(snapshot.analysisId());
    }

    @Test
    @DisplayName("Job running past its timeout fails and its late result is dropped")
    void timesOut() throws InterruptedException {
        blockUntilReleased();
        start(new JobConfig(1, Duration.ofMillis(50)));

        JobSnapshot snapshot = awaitTerminal(jobs.submit("erlotinib", AnalysisParams.defaults()));

        assertEquals(JobState.FAILED, snapshot.state());
        assertEquals("timed out after 50 ms", snapshot.error());
        assertNull(snapshot.analysisId());
    }

    @Test
    @DisplayName("Queued job can be canceled once")
    void cancelQueued() throws InterruptedException {
        blockUntilReleased();
        start(new JobConfig(1, Duration.ofSeconds(30)));
        String running = jobs.submit("erlotinib", AnalysisParams.defaults());
        String queued = jobs.submit("gefitinib", AnalysisParams.defaults());

        assertTrue(jobs.cancel(queued));
        assertFalse(jobs.cancel(queued));
        assertEquals(JobState.CANCELED, jobs.status(queued).orElseThrow().state());

        release.countDown();
        assertEquals(JobState.SUCCEEDED, awaitTerminal(running).state());
        assertEquals(JobState.CANCELED, jobs.status(queued).orElseThrow().state());
        assertEquals(2, jobs.size());
    }

    @Test
    @DisplayName("Finished jobs are dropped once their retention has passed, running ones are kept")
    void purgesExpiredJobs() throws InterruptedException {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        when(analysisService.run(eq("paracetamol"), any(), any()))
                .thenThrow(new CompoundNotFoundException("paracetamol"));
        blockUntilReleased();
        jobs = new AnalysisJobService(analysisService,
                new JobConfig(2, Duration.ofMinutes(5), Duration.ofMinutes(10)), clock);

        String running = jobs.submit("erlotinib", AnalysisParams.defaults());
        String failed = jobs.submit("paracetamol", AnalysisParams.defaults());
        assertEquals(JobState.FAILED, awaitTerminal(failed).state());

        clock.advance(Duration.ofMinutes(9));
        assertEquals(0, jobs.purgeExpired());
        assertEquals(2, jobs.size());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, jobs.purgeExpired());
        assertTrue(jobs.status(failed).isEmpty());
        assertFalse(jobs.status(running).orElseThrow().state().isTerminal());
        assertEquals(1, jobs.size());
    }

    @Test
    @DisplayName("Unknown job ids and blank queries")
    void unknownAndInvalid() {
        start(JobConfig.defaults());

        assertTrue(jobs.status("missing").isEmpty());
        assertFalse(jobs.cancel("missing"));
        assertThrows(ValidationException.class, () -> jobs.submit(" ", AnalysisParams.defaults()));
    }

    @Test
    @DisplayName("Job settings are validated")
    void configValidation() {
        assertThrows(ConfigurationException.class, () -> new JobConfig(0, Duration.ofSeconds(1)));
        assertThrows(ConfigurationException.class, () -> new JobConfig(1, Duration.ZERO));
        assertThrows(ConfigurationException.class,
                () -> new JobConfig(1, Duration.ofSeconds(1), Duration.ofMinutes(-1)));
        assertEquals(JobConfig.DEFAULT_RETENTION, new JobConfig(1, Duration.ofSeconds(1)).retention());
        assertTrue(JobState.CANCELED.isTerminal());
        assertFalse(JobState.RUNNING.isTerminal());
    }

    private static final class MutableClock extends Clock {
        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

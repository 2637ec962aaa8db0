package com.pathway.impact.upstream;

import com.pathway.impact.error.UpstreamUnavailableException;
import com.pathway.impact.metrics.MetricsService;
import com.pathway.impact.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Calls an upstream source, retrying transient {@link UpstreamUnavailableException}s with
 * bounded exponential backoff. Permanent failures and any other exception propagate on the
 * first attempt.
 */
public class RetryingInvoker {
    private static final Logger log = LoggerFactory.getLogger(RetryingInvoker.class);

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final MetricsService metrics;

    public RetryingInvoker(RetryPolicy policy) {
        this(policy, Sleeper.THREAD, new NoOpMetricsService());
    }

    public RetryingInvoker(RetryPolicy policy, Sleeper sleeper, MetricsService metrics) {
        this.policy = policy;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public <T> T call(String source, Callable<T> call) {
        UpstreamUnavailableException lastFailure = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return call.call();
            } catch (UpstreamUnavailableException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                lastFailure = e;
                log.warn("upstream.failed source={} attempt={}/{} error={}",
                        source, attempt, policy.maxAttempts(), e.getMessage());
                if (attempt < policy.maxAttempts()) {
                    metrics.incrementUpstreamRetry(source);
                    pause(source, policy.delayAfter(attempt));
                }
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new UpstreamUnavailableException(source, "unexpected failure: " + e.getMessage(), false, e);
            }
        }
        throw new UpstreamUnavailableException(source,
                "unavailable after " + policy.maxAttempts() + " attempt(s)", false, lastFailure);
    }

    public RetryPolicy getPolicy() {
        return policy;
    }

    private void pause(String source, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(source, "interrupted while backing off", false, e);
        }
    }
}

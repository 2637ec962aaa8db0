package com.pathway.impact.upstream;

import com.pathway.impact.error.ConfigurationException;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient upstream failures.
 *
 * @param maxAttempts  total attempts including the first call
 * @param initialDelay delay before the second attempt
 * @param multiplier   factor applied to the delay after each failed attempt
 * @param maxDelay     upper bound for a single delay
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new ConfigurationException("maxAttempts must be >= 1");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new ConfigurationException("initialDelay must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new ConfigurationException("multiplier must be >= 1.0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new ConfigurationException("maxDelay must be >= initialDelay");
        }
    }

    /**
     * Default policy: 3 attempts, 200ms initial delay, doubling, capped at 2s.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), 2.0, Duration.ofSeconds(2));
    }

    /**
     * A single attempt, no retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration delayAfter(int attempt) {
        double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
        long millis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
        return Duration.ofMillis(millis);
    }
}

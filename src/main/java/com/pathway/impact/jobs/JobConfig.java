package com.pathway.impact.jobs;

import com.pathway.impact.error.ConfigurationException;

import java.time.Duration;

/**
 * Worker pool, timeout and retention settings for background analyses.
 *
 * @param workerThreads analyses that may run at the same time
 * @param timeout       wall-clock budget per job, measured from the moment it starts running
 * @param retention     how long a finished, failed or canceled job stays queryable
 */
public record JobConfig(int workerThreads, Duration timeout, Duration retention) {

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(1);

    public JobConfig {
        if (workerThreads < 1) {
            throw new ConfigurationException("workerThreads must be >= 1");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new ConfigurationException("timeout must be positive");
        }
        if (retention == null || retention.isNegative()) {
            throw new ConfigurationException("retention must not be negative");
        }
    }

    public JobConfig(int workerThreads, Duration timeout) {
        this(workerThreads, timeout, DEFAULT_RETENTION);
    }

    public static JobConfig defaults() {
        return new JobConfig(4, Duration.ofMinutes(2), DEFAULT_RETENTION);
    }
}

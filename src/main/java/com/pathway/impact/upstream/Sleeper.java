package com.pathway.impact.upstream;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced in tests so backoff needs no wall-clock time.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

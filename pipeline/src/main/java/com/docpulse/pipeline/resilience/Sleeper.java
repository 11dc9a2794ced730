package com.docpulse.pipeline.resilience;

import java.time.Duration;

/**
 * Sleep primitive used between attempts. Swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

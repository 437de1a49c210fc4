package com.farearound.search.retry;

import java.time.Duration;

/**
 * Suspends the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> Thread.sleep(delay.toMillis());

    void sleep(Duration delay) throws InterruptedException;
}

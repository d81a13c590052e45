package com.pricewatch.tracker.harvest.fetch;

import java.time.Duration;

@FunctionalInterface
public interface BackoffSleeper {
    BackoffSleeper THREAD_SLEEP = delay -> Thread.sleep(Math.max(0L, delay.toMillis()));

    void sleep(Duration delay) throws InterruptedException;
}

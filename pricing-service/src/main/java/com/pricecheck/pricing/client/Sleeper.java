package com.pricecheck.pricing.client;

import java.time.Duration;

/**
 * Blocking pause used by the rate limiter and the retry loop. Tests substitute a recording
 * implementation so that pacing and backoff can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}

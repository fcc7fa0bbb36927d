package com.pricecheck.pricing.client;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.BlockingStrategy;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.TimeMeter;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Enforces a minimum interval of {@code 1 / requestsPerSecond} between consecutive requests of
 * one client.
 *
 * <p>Backed by a single-token Bucket4j bucket with greedy refill. Each caller reserves its slot
 * atomically and then waits out the reservation, so concurrent callers are served one after
 * another and N calls take at least {@code (N - 1) / requestsPerSecond}.
 */
public class IntervalRateLimiter {

    private final Duration minInterval;
    private final Bucket bucket;
    private final BlockingStrategy blockingStrategy;

    public IntervalRateLimiter(double requestsPerSecond) {
        this(requestsPerSecond, System::nanoTime, Sleeper.THREAD);
    }

    public IntervalRateLimiter(double requestsPerSecond, LongSupplier nanoTime, Sleeper sleeper) {
        if (!(requestsPerSecond > 0.0)) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0, got " + requestsPerSecond);
        }
        this.minInterval = Duration.ofNanos((long) (1_000_000_000L / requestsPerSecond));
        this.bucket = Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(1)
                .refillGreedy(1, minInterval)
                .build())
            .withCustomTimePrecision(new SuppliedTimeMeter(nanoTime))
            .build();
        this.blockingStrategy = nanosToPark -> sleeper.sleep(Duration.ofNanos(nanosToPark));
    }

    /**
     * Blocks until the next request may be sent.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void acquire() throws InterruptedException {
        bucket.asBlocking().consume(1, blockingStrategy);
    }

    public Duration getMinInterval() {
        return minInterval;
    }

    private static final class SuppliedTimeMeter implements TimeMeter {
        private final LongSupplier nanoTime;

        SuppliedTimeMeter(LongSupplier nanoTime) {
            this.nanoTime = nanoTime;
        }

        @Override
        public long currentTimeNanos() {
            return nanoTime.getAsLong();
        }

        public boolean isWallClockBased() {
            return false;
        }
    }
}

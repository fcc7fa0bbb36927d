package com.pricecheck.pricing.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-source tuning for a {@link RateLimitedCachingClient}.
 *
 * @param requestsPerSecond sustained request rate; {@code 0.33} means one request every ~3 s
 * @param cacheTtl          how long a successful GET response is served from memory
 * @param maxCacheEntries   cache bound; the oldest inserted entry is evicted first
 * @param maxRetries        retries after the first attempt for transient failures
 * @param baseBackoff       delay before the first retry, doubled on every further retry
 * @param maxBackoff        cap on the computed backoff (a server Retry-After is not capped)
 */
public record ClientSettings(
    double requestsPerSecond,
    Duration cacheTtl,
    int maxCacheEntries,
    int maxRetries,
    Duration baseBackoff,
    Duration maxBackoff
) {
    public ClientSettings {
        if (!(requestsPerSecond > 0.0) || Double.isInfinite(requestsPerSecond)) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0, got " + requestsPerSecond);
        }
        Objects.requireNonNull(cacheTtl, "cacheTtl");
        Objects.requireNonNull(baseBackoff, "baseBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxCacheEntries < 1) {
            throw new IllegalArgumentException("maxCacheEntries must be >= 1, got " + maxCacheEntries);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
    }

    /** One hour TTL, 1000 entries, 3 retries starting at 1 s capped at 60 s. */
    public static ClientSettings defaults(double requestsPerSecond) {
        return new ClientSettings(requestsPerSecond, Duration.ofHours(1), 1000, 3,
                                  Duration.ofSeconds(1), Duration.ofSeconds(60));
    }
}

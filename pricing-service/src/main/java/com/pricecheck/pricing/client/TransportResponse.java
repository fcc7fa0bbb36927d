package com.pricecheck.pricing.client;

import java.time.Duration;
import java.util.Optional;

/**
 * Raw outcome of one HTTP exchange: status, body text and the server's Retry-After hint, if any.
 */
public record TransportResponse(int status, String body, Duration retryAfter) {

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfter);
    }
}

package com.pricecheck.common.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Timeout, connection failure, 5xx or explicit rate-limit response. Retried with backoff by the
 * client; when the source sent a retry-after hint it is kept here and wins over computed backoff.
 */
public class TransientSourceException extends PriceSourceException {
    private final Duration retryAfter;

    public TransientSourceException(String sourceId, String message) {
        this(sourceId, message, null, null);
    }

    public TransientSourceException(String sourceId, String message, Throwable cause) {
        this(sourceId, message, null, cause);
    }

    public TransientSourceException(String sourceId, String message, Duration retryAfter, Throwable cause) {
        super(sourceId, message, cause);
        this.retryAfter = retryAfter;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}

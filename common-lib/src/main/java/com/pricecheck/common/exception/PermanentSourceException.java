package com.pricecheck.common.exception;

/**
 * Failure that retrying cannot fix: a 4xx other than rate limiting, a malformed body, adapter
 * misconfiguration, or a transient failure that outlived every retry.
 */
public class PermanentSourceException extends PriceSourceException {

    public PermanentSourceException(String sourceId, String message) {
        super(sourceId, message);
    }

    public PermanentSourceException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }
}

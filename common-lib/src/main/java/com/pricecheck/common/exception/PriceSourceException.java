package com.pricecheck.common.exception;

/**
 * Base failure raised while talking to an external pricing source. Carries the stable id of the
 * source so that callers can log and degrade per source.
 *
 * <p>{@link #getMessage()} is prefixed with {@code [sourceId]}; {@link #getReason()} is the bare
 * description for log lines that already print the source.
 */
public class PriceSourceException extends RuntimeException {
    private final String sourceId;
    private final String reason;

    public PriceSourceException(String sourceId, String message) {
        this(sourceId, message, null);
    }

    public PriceSourceException(String sourceId, String message, Throwable cause) {
        super("[" + sourceId + "] " + message, cause);
        this.sourceId = sourceId;
        this.reason   = message;
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Whether the same request may succeed if sent again later.
     */
    public boolean isRetryable() {
        return false;
    }
}

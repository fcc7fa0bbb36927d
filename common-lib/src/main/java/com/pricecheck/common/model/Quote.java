package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One source's answer to "what is this worth", before reconciliation.
 *
 * <p>{@code chaosValue} is expressed in the market's base currency unit. A value of 0 is
 * legitimate data. {@code sampleSize} is 0 when the source does not report listing counts.
 */
public record Quote(
    @JsonProperty("sourceId")      String sourceId,
    @JsonProperty("chaosValue")    double chaosValue,
    @JsonProperty("sampleSize")    int sampleSize,
    @JsonProperty("lowConfidence") boolean lowConfidence,
    @JsonProperty("fetchedAt")     Instant fetchedAt
) {
    public Quote {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        if (Double.isNaN(chaosValue) || Double.isInfinite(chaosValue) || chaosValue < 0.0) {
            throw new IllegalArgumentException("chaosValue must be a finite non-negative number, got " + chaosValue);
        }
        sampleSize = Math.max(0, sampleSize);
    }

    public static Quote of(String sourceId, double chaosValue, int sampleSize, boolean lowConfidence) {
        return new Quote(sourceId, chaosValue, sampleSize, lowConfidence, Instant.now());
    }
}

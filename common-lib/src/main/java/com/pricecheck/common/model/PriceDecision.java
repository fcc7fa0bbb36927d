package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Final reconciled price for one lookup.
 *
 * <p>Immutable: {@code contributingQuotes} is copied on construction. Owned by the caller once
 * returned; the engine keeps no reference.
 */
public record PriceDecision(
    @JsonProperty("chaosValue")         double chaosValue,
    @JsonProperty("confidence")         Confidence confidence,
    @JsonProperty("decisionSource")     String decisionSource,
    @JsonProperty("contributingQuotes") List<Quote> contributingQuotes
) {
    public static final String NOT_FOUND        = "not found";
    public static final String INVALID_IDENTITY = "invalid identity";

    public PriceDecision {
        Objects.requireNonNull(confidence, "confidence");
        Objects.requireNonNull(decisionSource, "decisionSource");
        contributingQuotes = contributingQuotes == null ? List.of() : List.copyOf(contributingQuotes);
    }

    public static PriceDecision notFound() {
        return new PriceDecision(0.0, Confidence.NONE, NOT_FOUND, List.of());
    }

    public static PriceDecision invalidIdentity() {
        return new PriceDecision(0.0, Confidence.NONE, INVALID_IDENTITY, List.of());
    }
}

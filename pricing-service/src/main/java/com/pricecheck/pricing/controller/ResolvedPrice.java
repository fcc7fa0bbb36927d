package com.pricecheck.pricing.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pricecheck.common.model.Confidence;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;

import java.util.List;

/**
 * Response body of a price lookup: the decision plus its value in Divine Orbs.
 * {@code divineValue} and {@code divineRate} are {@code null} when no rate is known or nothing
 * was found.
 */
public record ResolvedPrice(
    @JsonProperty("chaosValue")         double chaosValue,
    @JsonProperty("divineValue")        Double divineValue,
    @JsonProperty("divineRate")         Double divineRate,
    @JsonProperty("confidence")         Confidence confidence,
    @JsonProperty("decisionSource")     String decisionSource,
    @JsonProperty("contributingQuotes") List<Quote> contributingQuotes
) {
    public static ResolvedPrice of(PriceDecision decision, Double divineRate) {
        boolean convertible = divineRate != null && divineRate > 0.0 && decision.confidence() != Confidence.NONE;
        return new ResolvedPrice(
            decision.chaosValue(),
            convertible ? decision.chaosValue() / divineRate : null,
            convertible ? divineRate : null,
            decision.confidence(),
            decision.decisionSource(),
            decision.contributingQuotes());
    }
}

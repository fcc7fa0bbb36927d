package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single quote sent to the price history outside of a full arbitration round.
 */
public record QuoteSubmission(
    @JsonProperty("identity") ItemIdentity identity,
    @JsonProperty("market")   MarketContext market,
    @JsonProperty("quote")    Quote quote
) {
    public QuoteSubmission {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(market, "market");
        Objects.requireNonNull(quote, "quote");
    }
}

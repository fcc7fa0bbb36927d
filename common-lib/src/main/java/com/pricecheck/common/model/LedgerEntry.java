package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One arbitration round as written to the price history: the identity and market it was run
 * for, every quote that arrived, and the resulting decision.
 */
public record LedgerEntry(
    @JsonProperty("identity")   ItemIdentity identity,
    @JsonProperty("market")     MarketContext market,
    @JsonProperty("quotes")     List<Quote> quotes,
    @JsonProperty("decision")   PriceDecision decision,
    @JsonProperty("recordedAt") Instant recordedAt
) {
    public LedgerEntry {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(market, "market");
        Objects.requireNonNull(decision, "decision");
        quotes     = quotes == null ? List.of() : List.copyOf(quotes);
        recordedAt = recordedAt == null ? Instant.now() : recordedAt;
    }
}

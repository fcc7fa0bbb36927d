package com.pricecheck.pricing.adapter;

import com.pricecheck.common.model.Game;
import com.pricecheck.common.model.MarketContext;

import java.util.Optional;

/**
 * A source that can tell how many base-currency units one Divine Orb is worth in a market.
 */
public interface DivineRateSource {

    boolean supports(Game game);

    /**
     * @return base-currency units per Divine Orb; empty when the source does not list it
     */
    Optional<Double> divineRate(MarketContext market);
}

package com.pricecheck.pricing.adapter;

import com.pricecheck.common.exception.PriceSourceException;
import com.pricecheck.common.model.Game;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.Quote;

import java.util.Optional;

/**
 * One external pricing service, seen from the arbitration engine.
 *
 * <p>Implementations own their {@code RateLimitedCachingClient} and translate the service's
 * response format into a normalized {@link Quote}. The engine calls {@link #findQuote} from
 * worker threads, possibly concurrently for different items, so implementations must be
 * thread-safe.
 */
public interface SourceAdapter {

    /** Stable identifier, also used in decision labels ("ninja", "watch", ...). */
    String sourceId();

    boolean supports(Game game);

    /**
     * @return the source's quote; empty when the item is unknown to the source, the source does
     *         not serve the game, or the identity cannot be priced by name (rare and magic items)
     * @throws PriceSourceException when the source cannot be reached or answers unusably
     */
    Optional<Quote> findQuote(ItemIdentity identity, MarketContext market);
}

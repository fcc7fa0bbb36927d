package com.pricecheck.common.ledger;

import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.LedgerEntry;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;

import java.util.List;

/**
 * Port to the persistent store that keeps historical quotes and decisions.
 *
 * <p>Current implementation: {@code HistoryServiceQuoteStore} in pricing-service, which sends
 * each {@link LedgerEntry} to history-service in a single request.
 *
 * <p>Writes are fire-and-forget from the engine's point of view: callers never let a store
 * failure reach the price lookup.
 */
public interface QuoteStore {

    void saveQuote(ItemIdentity identity, MarketContext market, Quote quote);

    void saveDecision(ItemIdentity identity, MarketContext market, PriceDecision decision);

    /**
     * @return most recent quotes for the item in the market, newest first
     */
    List<Quote> loadRecentQuotes(ItemIdentity identity, MarketContext market, int limit);

    /**
     * Persists a whole arbitration round. Stores that support batching should override this;
     * the default issues one {@link #saveQuote} per quote followed by {@link #saveDecision}.
     */
    default void saveEntry(LedgerEntry entry) {
        for (Quote quote : entry.quotes()) {
            saveQuote(entry.identity(), entry.market(), quote);
        }
        saveDecision(entry.identity(), entry.market(), entry.decision());
    }
}

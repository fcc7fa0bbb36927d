package com.pricecheck.pricing.ledger;

import com.pricecheck.common.ledger.QuoteStore;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.LedgerEntry;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;

/**
 * Writes each arbitration round to the {@link QuoteStore} in the background.
 *
 * <p>Fire-and-forget: {@link #record} returns as soon as the write is scheduled and every store
 * failure is logged here, never rethrown. A broken history store costs history, not prices.
 */
public class QuoteLedger {

    private static final Logger log = LoggerFactory.getLogger(QuoteLedger.class);

    private final QuoteStore store;
    private final Scheduler scheduler;

    public QuoteLedger(QuoteStore store) {
        this(store, Schedulers.boundedElastic());
    }

    public QuoteLedger(QuoteStore store, Scheduler scheduler) {
        this.store     = store;
        this.scheduler = scheduler;
    }

    public void record(ItemIdentity identity, MarketContext market, List<Quote> quotes, PriceDecision decision) {
        try {
            LedgerEntry entry = new LedgerEntry(identity, market, quotes, decision, Instant.now());
            Mono.fromRunnable(() -> store.saveEntry(entry))
                .subscribeOn(scheduler)
                .subscribe(
                    ignored -> { },
                    err -> log.warn("Ledger write failed (non-critical). item={} league={} reason={}",
                                    identity.displayName(), market.league(), err.getMessage()),
                    () -> log.debug("Ledger entry recorded. item={} league={} quotes={}",
                                    identity.displayName(), market.league(), entry.quotes().size()));
        } catch (RuntimeException e) {
            log.warn("Ledger write could not be scheduled. item={} reason={}",
                     identity == null ? null : identity.displayName(), e.getMessage());
        }
    }

    /**
     * @return recent quotes, newest first; empty when the store cannot be read
     */
    public List<Quote> recentQuotes(ItemIdentity identity, MarketContext market, int limit) {
        try {
            return store.loadRecentQuotes(identity, market, limit);
        } catch (RuntimeException e) {
            log.warn("Ledger read failed. item={} league={} reason={}",
                     identity.displayName(), market.league(), e.getMessage());
            return List.of();
        }
    }
}

package com.pricecheck.pricing.ledger;

import com.pricecheck.common.ledger.QuoteStore;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.LedgerEntry;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;
import com.pricecheck.common.model.QuoteSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * {@link QuoteStore} backed by history-service over REST.
 *
 * <p>Calls block: the ledger invokes the store from a bounded-elastic worker, never from an
 * event-loop thread.
 */
public class HistoryServiceQuoteStore implements QuoteStore {

    private static final Logger log = LoggerFactory.getLogger(HistoryServiceQuoteStore.class);

    private static final ParameterizedTypeReference<List<Quote>> QUOTE_LIST =
        new ParameterizedTypeReference<>() {};

    private final WebClient historyClient;
    private final Duration timeout;

    public HistoryServiceQuoteStore(WebClient historyClient, Duration timeout) {
        this.historyClient = historyClient;
        this.timeout       = timeout;
    }

    @Override
    public void saveQuote(ItemIdentity identity, MarketContext market, Quote quote) {
        historyClient.post()
            .uri("/api/v1/history/quotes")
            .bodyValue(new QuoteSubmission(identity, market, quote))
            .retrieve()
            .toBodilessEntity()
            .block(timeout);
    }

    @Override
    public void saveDecision(ItemIdentity identity, MarketContext market, PriceDecision decision) {
        saveEntry(new LedgerEntry(identity, market, List.of(), decision, Instant.now()));
    }

    @Override
    public void saveEntry(LedgerEntry entry) {
        historyClient.post()
            .uri("/api/v1/history/price-checks")
            .bodyValue(entry)
            .retrieve()
            .toBodilessEntity()
            .doOnSuccess(r -> log.debug("Price check stored. item={} status={}",
                                        entry.identity().displayName(), r.getStatusCode()))
            .block(timeout);
    }

    @Override
    public List<Quote> loadRecentQuotes(ItemIdentity identity, MarketContext market, int limit) {
        List<Quote> quotes = historyClient.get()
            .uri(builder -> builder.path("/api/v1/history/quotes")
                .queryParam("item", "{item}")
                .queryParam("league", "{league}")
                .queryParam("game", market.game())
                .queryParam("limit", limit)
                .build(identity.displayName(), market.league()))
            .retrieve()
            .bodyToMono(QUOTE_LIST)
            .block(timeout);
        return quotes == null ? List.of() : quotes;
    }
}

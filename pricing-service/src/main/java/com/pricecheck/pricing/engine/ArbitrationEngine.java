package com.pricecheck.pricing.engine;

import com.pricecheck.common.arbitration.ArbitrationStrategy;
import com.pricecheck.common.exception.PriceSourceException;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;
import com.pricecheck.pricing.adapter.SourceAdapter;
import com.pricecheck.pricing.ledger.QuoteLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Resolves one item to a single {@link PriceDecision} by asking every registered source and
 * reconciling the answers.
 *
 * <h3>Lookup</h3>
 * <ol>
 *   <li>Invalid identity → NONE decision, no source is called.</li>
 *   <li>Each adapter serving the market's game runs on its own bounded-elastic worker.</li>
 *   <li>A failing adapter is logged and contributes no quote; the others are unaffected.</li>
 *   <li>When the lookup timeout elapses, outstanding calls are cancelled and the quotes that
 *       already arrived are arbitrated.</li>
 *   <li>Quotes are put back into adapter registration order before the
 *       {@link ArbitrationStrategy} runs, so identical answers give identical decisions.</li>
 *   <li>The round is handed to the {@link QuoteLedger}; the caller never waits for the write.</li>
 * </ol>
 *
 * <p>Holds no per-lookup state, so concurrent lookups are independent.
 */
public class ArbitrationEngine {

    private static final Logger log = LoggerFactory.getLogger(ArbitrationEngine.class);

    private final List<SourceAdapter> adapters;
    private final ArbitrationStrategy strategy;
    private final QuoteLedger ledger;
    private final Duration defaultTimeout;
    private final Scheduler scheduler;

    public ArbitrationEngine(List<SourceAdapter> adapters, ArbitrationStrategy strategy,
                             QuoteLedger ledger, Duration defaultTimeout) {
        this(adapters, strategy, ledger, defaultTimeout, Schedulers.boundedElastic());
    }

    public ArbitrationEngine(List<SourceAdapter> adapters, ArbitrationStrategy strategy,
                             QuoteLedger ledger, Duration defaultTimeout, Scheduler scheduler) {
        this.adapters       = List.copyOf(adapters);
        this.strategy       = strategy;
        this.ledger         = ledger;
        this.defaultTimeout = defaultTimeout;
        this.scheduler      = scheduler;
    }

    public PriceDecision resolvePrice(ItemIdentity identity, MarketContext market) {
        return resolvePrice(identity, market, defaultTimeout);
    }

    /**
     * @param timeout overall lookup budget; {@code null} means the configured default
     */
    public PriceDecision resolvePrice(ItemIdentity identity, MarketContext market, Duration timeout) {
        if (identity == null || !identity.isValid()) {
            log.warn("Rejected lookup with invalid identity. identity={}", identity);
            return PriceDecision.invalidIdentity();
        }

        List<Quote> quotes = collectQuotes(identity, market, timeout == null ? defaultTimeout : timeout);
        PriceDecision decision = strategy.decide(quotes);
        log.info("Price resolved. item={} league={} game={} value={} confidence={} source=\"{}\" quotes={}",
                 identity.displayName(), market.league(), market.game(),
                 decision.chaosValue(), decision.confidence(), decision.decisionSource(), quotes.size());

        ledger.record(identity, market, quotes, decision);
        return decision;
    }

    public List<String> sourceIds() {
        return adapters.stream().map(SourceAdapter::sourceId).toList();
    }

    private List<Quote> collectQuotes(ItemIdentity identity, MarketContext market, Duration timeout) {
        List<OrderedQuote> arrived = Flux.range(0, adapters.size())
            .filter(i -> adapters.get(i).supports(market.game()))
            .flatMap(i -> {
                SourceAdapter adapter = adapters.get(i);
                return Mono.fromCallable(() -> adapter.findQuote(identity, market))
                    .subscribeOn(scheduler)
                    .flatMap(Mono::justOrEmpty)
                    .map(quote -> new OrderedQuote(i, quote))
                    .onErrorResume(e -> {
                        logSourceFailure(adapter, identity, e);
                        return Mono.empty();
                    });
            })
            .take(timeout)
            .collectList()
            .block();

        if (arrived == null) {
            return List.of();
        }
        List<OrderedQuote> ordered = new ArrayList<>(arrived);
        ordered.sort(Comparator.comparingInt(OrderedQuote::order));
        return ordered.stream().map(OrderedQuote::quote).toList();
    }

    private static void logSourceFailure(SourceAdapter adapter, ItemIdentity identity, Throwable e) {
        if (e instanceof PriceSourceException) {
            PriceSourceException failure = (PriceSourceException) e;
            log.warn("Source failed, continuing without it. source={} item={} retryable={} reason={}",
                     failure.getSourceId(), identity.displayName(), failure.isRetryable(), failure.getReason());
        } else {
            log.warn("Source failed unexpectedly, continuing without it. source={} item={} reason={}",
                     adapter.sourceId(), identity.displayName(), e.toString());
        }
    }

    private record OrderedQuote(int order, Quote quote) {}
}

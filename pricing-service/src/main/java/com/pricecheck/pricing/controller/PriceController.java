package com.pricecheck.pricing.controller;

import com.pricecheck.common.model.Confidence;
import com.pricecheck.common.model.Game;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;
import com.pricecheck.common.model.Rarity;
import com.pricecheck.pricing.client.ResponseCache;
import com.pricecheck.pricing.client.SourceClients;
import com.pricecheck.pricing.engine.ArbitrationEngine;
import com.pricecheck.pricing.engine.DivineValueConverter;
import com.pricecheck.pricing.ledger.QuoteLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/price")
public class PriceController {

    private final ArbitrationEngine engine;
    private final QuoteLedger ledger;
    private final SourceClients sourceClients;
    private final DivineValueConverter divineConverter;

    public PriceController(ArbitrationEngine engine, QuoteLedger ledger, SourceClients sourceClients,
                           DivineValueConverter divineConverter) {
        this.engine          = engine;
        this.ledger          = ledger;
        this.sourceClients   = sourceClients;
        this.divineConverter = divineConverter;
    }

    /**
     * Resolves one item. An identity without name and base type is rejected with 400.
     * The response carries the value in Divine Orbs next to the base-currency value.
     */
    @GetMapping("/resolve")
    public Mono<ResponseEntity<ResolvedPrice>> resolve(
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String baseType,
            @RequestParam(defaultValue = "UNKNOWN") Rarity rarity,
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "1") int stackSize,
            @RequestParam String league,
            @RequestParam(defaultValue = "POE1") Game game) {
        return Mono.fromCallable(() -> {
                ItemIdentity identity = new ItemIdentity(name, baseType, rarity, category, stackSize).requireValid();
                MarketContext market = new MarketContext(league, game);
                PriceDecision decision = engine.resolvePrice(identity, market);
                Double divineRate = decision.confidence() == Confidence.NONE
                    ? null
                    : divineConverter.divineRate(market).orElse(null);
                return ResolvedPrice.of(decision, divineRate);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/history")
    public Mono<List<Quote>> history(
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String baseType,
            @RequestParam String league,
            @RequestParam(defaultValue = "POE1") Game game,
            @RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> {
                ItemIdentity identity = ItemIdentity.of(name, baseType, Rarity.UNKNOWN).requireValid();
                return ledger.recentQuotes(identity, new MarketContext(league, game), limit);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/cache-stats")
    public Map<String, ResponseCache.CacheStats> cacheStats() {
        return sourceClients.cacheStats();
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCaches() {
        sourceClients.clearCaches();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/sources")
    public List<String> sources() {
        return engine.sourceIds();
    }
}

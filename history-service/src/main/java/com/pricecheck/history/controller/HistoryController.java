package com.pricecheck.history.controller;

import com.pricecheck.common.model.Game;
import com.pricecheck.common.model.LedgerEntry;
import com.pricecheck.common.model.Quote;
import com.pricecheck.common.model.QuoteSubmission;
import com.pricecheck.common.stats.PriceStatistics;
import com.pricecheck.history.model.PriceCheckRecord;
import com.pricecheck.history.service.PriceHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    private final PriceHistoryService historyService;

    public HistoryController(PriceHistoryService historyService) {
        this.historyService = historyService;
    }

    @PostMapping("/price-checks")
    public Mono<ResponseEntity<Void>> savePriceCheck(@RequestBody LedgerEntry entry) {
        log.info("Received price check for persistence. item={} league={} confidence={}",
                 entry.identity().displayName(), entry.market().league(), entry.decision().confidence());
        return historyService.saveEntry(entry)
            .then(Mono.just(ResponseEntity.ok().<Void>build()))
            .doOnError(e -> log.error("Save endpoint error. item={}", entry.identity().displayName(), e));
    }

    @PostMapping("/quotes")
    public Mono<ResponseEntity<Void>> saveQuote(@RequestBody QuoteSubmission submission) {
        return historyService.saveQuote(submission)
            .then(Mono.just(ResponseEntity.ok().<Void>build()));
    }

    @GetMapping("/quotes")
    public Flux<Quote> recentQuotes(@RequestParam String item,
                                    @RequestParam String league,
                                    @RequestParam(defaultValue = "POE1") Game game,
                                    @RequestParam(defaultValue = "20") int limit) {
        log.info("Recent quotes query received. item={} league={} game={}", item, league, game);
        return historyService.recentQuotes(item, league, game, limit);
    }

    @GetMapping("/decisions")
    public Flux<PriceCheckRecord> recentDecisions(@RequestParam String item,
                                                  @RequestParam String league,
                                                  @RequestParam(defaultValue = "POE1") Game game,
                                                  @RequestParam(defaultValue = "20") int limit) {
        log.info("Recent decisions query received. item={} league={} game={}", item, league, game);
        return historyService.recentDecisions(item, league, game, limit);
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<PriceStatistics>> statistics(@RequestParam String item,
                                                            @RequestParam String league,
                                                            @RequestParam(defaultValue = "POE1") Game game,
                                                            @RequestParam(defaultValue = "7") int days) {
        log.info("Price statistics query received. item={} league={} days={}", item, league, days);
        return historyService.statistics(item, league, game, days)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Statistics endpoint error. item={}", item, e));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}

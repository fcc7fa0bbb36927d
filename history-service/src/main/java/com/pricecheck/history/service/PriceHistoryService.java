package com.pricecheck.history.service;

import com.pricecheck.common.matching.ItemNameNormalizer;
import com.pricecheck.common.model.Game;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.LedgerEntry;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;
import com.pricecheck.common.model.QuoteSubmission;
import com.pricecheck.common.stats.PriceStatistics;
import com.pricecheck.history.model.PriceCheckRecord;
import com.pricecheck.history.model.PriceQuoteRecord;
import com.pricecheck.history.repository.PriceCheckRecordRepository;
import com.pricecheck.history.repository.PriceQuoteRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Persists price checks and serves them back as recent quotes, recent decisions and
 * statistics. Items are keyed by their normalized display name, so "Divine Orb" and
 * "divine orb" share one history.
 */
@Service
public class PriceHistoryService {

    private static final Logger log = LoggerFactory.getLogger(PriceHistoryService.class);

    static final int MAX_LIMIT = 500;

    private final PriceCheckRecordRepository checkRepository;
    private final PriceQuoteRecordRepository quoteRepository;
    private final Clock clock;

    @Autowired
    public PriceHistoryService(PriceCheckRecordRepository checkRepository,
                               PriceQuoteRecordRepository quoteRepository) {
        this(checkRepository, quoteRepository, Clock.systemUTC());
    }

    PriceHistoryService(PriceCheckRecordRepository checkRepository,
                        PriceQuoteRecordRepository quoteRepository,
                        Clock clock) {
        this.checkRepository = checkRepository;
        this.quoteRepository = quoteRepository;
        this.clock           = clock;
    }

    public Mono<PriceCheckRecord> saveEntry(LedgerEntry entry) {
        return Mono.fromCallable(() -> toCheckRecord(entry))
            .flatMap(checkRepository::save)
            .flatMap(saved -> Flux.fromIterable(entry.quotes())
                .map(quote -> toQuoteRecord(entry.identity(), entry.market(), quote, saved.getId()))
                .collectList()
                .flatMapMany(quoteRepository::saveAll)
                .then(Mono.just(saved)))
            .doOnSuccess(saved -> log.info("Price check persisted. id={} item={} league={} value={} confidence={} quotes={}",
                                           saved.getId(), saved.getItemName(), saved.getLeague(),
                                           saved.getChaosValue(), saved.getConfidence(), saved.getQuoteCount()))
            .doOnError(e -> log.error("Failed to persist price check. item={}",
                                      entry.identity().displayName(), e));
    }

    public Mono<PriceQuoteRecord> saveQuote(QuoteSubmission submission) {
        return Mono.fromCallable(() -> toQuoteRecord(submission.identity(), submission.market(),
                                                     submission.quote(), null))
            .flatMap(quoteRepository::save)
            .doOnSuccess(saved -> log.debug("Quote persisted. id={} item={} source={}",
                                            saved.getId(), saved.getItemName(), saved.getSourceId()))
            .doOnError(e -> log.error("Failed to persist quote. item={}",
                                      submission.identity().displayName(), e));
    }

    /**
     * @return newest first
     */
    public Flux<Quote> recentQuotes(String item, String league, Game game, int limit) {
        return quoteRepository.findRecent(key(item), league.trim(), game.name(), clampLimit(limit))
            .map(PriceHistoryService::toQuote);
    }

    /**
     * @return newest first
     */
    public Flux<PriceCheckRecord> recentDecisions(String item, String league, Game game, int limit) {
        return checkRepository.findRecent(key(item), league.trim(), game.name(), clampLimit(limit));
    }

    /**
     * Statistics over every quote of the item recorded in the last {@code days} days.
     */
    public Mono<PriceStatistics> statistics(String item, String league, Game game, int days) {
        LocalDateTime since = LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).minusDays(Math.max(1, days));
        return quoteRepository.findSince(key(item), league.trim(), game.name(), since)
            .map(PriceQuoteRecord::getChaosValue)
            .collectList()
            .map(PriceStatistics::of);
    }

    // ── mapping ──────────────────────────────────────────────────────────────

    private PriceCheckRecord toCheckRecord(LedgerEntry entry) {
        ItemIdentity identity = entry.identity();
        PriceDecision decision = entry.decision();

        PriceCheckRecord record = new PriceCheckRecord();
        record.setItemName(identity.displayName());
        record.setItemKey(key(identity.displayName()));
        record.setBaseType(identity.baseType());
        record.setRarity(identity.rarity().name());
        record.setCategory(identity.category());
        record.setLeague(entry.market().league());
        record.setGame(entry.market().game().name());
        record.setChaosValue(decision.chaosValue());
        record.setConfidence(decision.confidence().name());
        record.setDecisionSource(decision.decisionSource());
        record.setQuoteCount(entry.quotes().size());
        record.setCheckedAt(toUtc(entry.recordedAt()));
        return record;
    }

    private PriceQuoteRecord toQuoteRecord(ItemIdentity identity, MarketContext market, Quote quote, Long checkId) {
        PriceQuoteRecord record = new PriceQuoteRecord();
        record.setPriceCheckId(checkId);
        record.setItemName(identity.displayName());
        record.setItemKey(key(identity.displayName()));
        record.setLeague(market.league());
        record.setGame(market.game().name());
        record.setSourceId(quote.sourceId());
        record.setChaosValue(quote.chaosValue());
        record.setSampleSize(quote.sampleSize());
        record.setLowConfidence(quote.lowConfidence());
        record.setFetchedAt(toUtc(quote.fetchedAt()));
        return record;
    }

    private static Quote toQuote(PriceQuoteRecord record) {
        return new Quote(record.getSourceId(), record.getChaosValue(), record.getSampleSize(),
                         record.isLowConfidence(), record.getFetchedAt().toInstant(ZoneOffset.UTC));
    }

    private static String key(String item) {
        String key = ItemNameNormalizer.normalize(item);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("item must not be blank");
        }
        return key;
    }

    private static int clampLimit(int limit) {
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}

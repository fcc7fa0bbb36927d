package com.pricecheck.history.service;

import com.pricecheck.common.model.Confidence;
import com.pricecheck.common.model.Game;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.LedgerEntry;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;
import com.pricecheck.common.stats.PriceStatistics;
import com.pricecheck.history.model.PriceCheckRecord;
import com.pricecheck.history.model.PriceQuoteRecord;
import com.pricecheck.history.repository.PriceCheckRecordRepository;
import com.pricecheck.history.repository.PriceQuoteRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PriceHistoryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final MarketContext SETTLERS = MarketContext.poe1("Settlers");

    private PriceCheckRecordRepository checkRepository;
    private PriceQuoteRecordRepository quoteRepository;
    private PriceHistoryService service;

    @BeforeEach
    void setUp() {
        checkRepository = mock(PriceCheckRecordRepository.class);
        quoteRepository = mock(PriceQuoteRecordRepository.class);
        service = new PriceHistoryService(checkRepository, quoteRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("an entry becomes one price_check row and one price_quote row per quote")
    @SuppressWarnings("unchecked")
    void saveEntry() {
        when(checkRepository.save(any(PriceCheckRecord.class))).thenAnswer(inv -> {
            PriceCheckRecord record = inv.getArgument(0);
            record.setId(42L);
            return Mono.just(record);
        });
        when(quoteRepository.saveAll(anyIterable())).thenAnswer(inv -> {
            Iterable<PriceQuoteRecord> rows = inv.getArgument(0);
            return Flux.fromIterable(rows);
        });

        List<Quote> quotes = List.of(
            new Quote("ninja", 100.0, 12, false, NOW),
            new Quote("watch", 160.0, 3, true, NOW));
        PriceDecision decision = new PriceDecision(130.0, Confidence.MEDIUM, "averaged(ninja,watch)", quotes);
        LedgerEntry entry = new LedgerEntry(ItemIdentity.unique("Shavronne's Wrappings", "Occultist's Vestment"),
                                            SETTLERS, quotes, decision, NOW);

        StepVerifier.create(service.saveEntry(entry))
            .assertNext(saved -> {
                assertEquals(42L, saved.getId());
                assertEquals("Shavronne's Wrappings", saved.getItemName());
                assertEquals("shavronnes wrappings", saved.getItemKey());
                assertEquals("UNIQUE", saved.getRarity());
                assertEquals("POE1", saved.getGame());
                assertEquals(130.0, saved.getChaosValue());
                assertEquals("MEDIUM", saved.getConfidence());
                assertEquals(2, saved.getQuoteCount());
                assertEquals(LocalDateTime.of(2026, 3, 10, 12, 0), saved.getCheckedAt());
            })
            .verifyComplete();

        ArgumentCaptor<Iterable<PriceQuoteRecord>> captor = ArgumentCaptor.forClass(Iterable.class);
        verify(quoteRepository).saveAll(captor.capture());
        List<PriceQuoteRecord> rows = new ArrayList<>();
        captor.getValue().forEach(rows::add);
        assertEquals(2, rows.size());
        assertEquals(42L, rows.get(0).getPriceCheckId());
        assertEquals("ninja", rows.get(0).getSourceId());
        assertTrue(rows.get(1).isLowConfidence());
    }

    @Test
    @DisplayName("recent quotes are looked up by normalized name and mapped back to quotes")
    void recentQuotes() {
        PriceQuoteRecord row = new PriceQuoteRecord();
        row.setSourceId("ninja");
        row.setChaosValue(180.0);
        row.setSampleSize(300);
        row.setFetchedAt(LocalDateTime.of(2026, 3, 10, 11, 0));
        when(quoteRepository.findRecent(eq("divine orb"), eq("Settlers"), eq("POE1"), anyInt()))
            .thenReturn(Flux.just(row));

        StepVerifier.create(service.recentQuotes("Divine Orb", "Settlers", Game.POE1, 10))
            .assertNext(quote -> {
                assertEquals("ninja", quote.sourceId());
                assertEquals(180.0, quote.chaosValue());
                assertEquals(Instant.parse("2026-03-10T11:00:00Z"), quote.fetchedAt());
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("limits are clamped to a sane range")
    void limitClamped() {
        when(quoteRepository.findRecent(any(), any(), any(), anyInt())).thenReturn(Flux.empty());

        service.recentQuotes("Divine Orb", "Settlers", Game.POE1, 10_000).blockLast();
        service.recentQuotes("Divine Orb", "Settlers", Game.POE1, 0).blockLast();

        verify(quoteRepository).findRecent("divine orb", "Settlers", "POE1", PriceHistoryService.MAX_LIMIT);
        verify(quoteRepository).findRecent("divine orb", "Settlers", "POE1", 1);
    }

    @Test
    @DisplayName("statistics cover quotes since now minus the requested days")
    void statistics() {
        List<PriceQuoteRecord> rows = new ArrayList<>();
        for (double value : new double[] {10.0, 20.0, 30.0, 40.0}) {
            PriceQuoteRecord row = new PriceQuoteRecord();
            row.setChaosValue(value);
            rows.add(row);
        }
        LocalDateTime since = LocalDateTime.of(2026, 3, 3, 12, 0);
        when(quoteRepository.findSince("divine orb", "Settlers", "POE1", since)).thenReturn(Flux.fromIterable(rows));

        PriceStatistics stats = service.statistics("Divine Orb", "Settlers", Game.POE1, 7).block();

        assertNotNull(stats);
        assertEquals(4, stats.count());
        assertEquals(25.0, stats.median());
        assertEquals(25.0, stats.trimmedMean());
    }

    @Test
    @DisplayName("no recorded quotes gives empty statistics")
    void emptyStatistics() {
        when(quoteRepository.findSince(any(), any(), any(), any())).thenReturn(Flux.empty());

        PriceStatistics stats = service.statistics("Mirror of Kalandra", "Settlers", Game.POE1, 30).block();

        assertNotNull(stats);
        assertEquals(0, stats.count());
        assertNull(stats.mean());
    }

    @Test
    @DisplayName("blank item names are rejected")
    void blankItem() {
        assertThrows(IllegalArgumentException.class,
            () -> service.recentQuotes("  ", "Settlers", Game.POE1, 5));
    }
}

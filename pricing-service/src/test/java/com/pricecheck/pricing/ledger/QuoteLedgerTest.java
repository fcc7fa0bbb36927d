package com.pricecheck.pricing.ledger;

import com.pricecheck.common.ledger.QuoteStore;
import com.pricecheck.common.model.Confidence;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.LedgerEntry;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.scheduler.Schedulers;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class QuoteLedgerTest {

    private static final ItemIdentity DIVINE = ItemIdentity.currency("Divine Orb");
    private static final MarketContext SETTLERS = MarketContext.poe1("Settlers");

    private QuoteStore store;
    private List<Quote> quotes;
    private PriceDecision decision;

    @BeforeEach
    void setUp() {
        store    = mock(QuoteStore.class);
        quotes   = List.of(Quote.of("ninja", 100.0, 10, false), Quote.of("watch", 105.0, 8, false));
        decision = new PriceDecision(100.0, Confidence.HIGH, "ninja, validated by watch", quotes);
    }

    @Test
    @DisplayName("one entry with every quote and the decision reaches the store")
    void recordsEntry() {
        QuoteLedger ledger = new QuoteLedger(store, Schedulers.immediate());

        ledger.record(DIVINE, SETTLERS, quotes, decision);

        ArgumentCaptor<LedgerEntry> captor = ArgumentCaptor.forClass(LedgerEntry.class);
        verify(store).saveEntry(captor.capture());
        LedgerEntry entry = captor.getValue();
        assertEquals(DIVINE, entry.identity());
        assertEquals(SETTLERS, entry.market());
        assertEquals(quotes, entry.quotes());
        assertEquals(decision, entry.decision());
        assertNotNull(entry.recordedAt());
    }

    @Test
    @DisplayName("store failures are swallowed")
    void storeFailureSwallowed() {
        doThrow(new IllegalStateException("history-service down")).when(store).saveEntry(any());
        QuoteLedger ledger = new QuoteLedger(store, Schedulers.immediate());

        assertDoesNotThrow(() -> ledger.record(DIVINE, SETTLERS, quotes, decision));
    }

    @Test
    @DisplayName("record returns before a slow store finishes")
    void doesNotBlockCaller() {
        doAnswer(inv -> {
            Thread.sleep(1_000);
            return null;
        }).when(store).saveEntry(any());
        QuoteLedger ledger = new QuoteLedger(store);

        long start = System.nanoTime();
        ledger.record(DIVINE, SETTLERS, quotes, decision);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertTrue(elapsedMs < 500, "elapsed " + elapsedMs + "ms");
        verify(store, timeout(3_000)).saveEntry(any());
    }

    @Test
    @DisplayName("read failures yield an empty history")
    void readFailure() {
        when(store.loadRecentQuotes(any(), any(), anyInt())).thenThrow(new IllegalStateException("timeout"));
        QuoteLedger ledger = new QuoteLedger(store, Schedulers.immediate());

        assertTrue(ledger.recentQuotes(DIVINE, SETTLERS, 10).isEmpty());
    }

    @Test
    @DisplayName("default saveEntry writes each quote and then the decision")
    void defaultSaveEntry() {
        QuoteStore looping = mock(QuoteStore.class, CALLS_REAL_METHODS);
        doNothing().when(looping).saveQuote(any(), any(), any());
        doNothing().when(looping).saveDecision(any(), any(), any());

        looping.saveEntry(new LedgerEntry(DIVINE, SETTLERS, quotes, decision, null));

        verify(looping, times(2)).saveQuote(eq(DIVINE), eq(SETTLERS), any());
        verify(looping).saveDecision(DIVINE, SETTLERS, decision);
    }
}

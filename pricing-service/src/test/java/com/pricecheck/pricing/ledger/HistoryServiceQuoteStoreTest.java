package com.pricecheck.pricing.ledger;

import com.pricecheck.common.model.Confidence;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.LedgerEntry;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HistoryServiceQuoteStoreTest {

    private static final ItemIdentity DIVINE = ItemIdentity.currency("Divine Orb");
    private static final MarketContext SETTLERS = MarketContext.poe1("Settlers");

    private final AtomicReference<ClientRequest> seen = new AtomicReference<>();

    private HistoryServiceQuoteStore store(ClientResponse response) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://history-service")
            .exchangeFunction(request -> {
                seen.set(request);
                return Mono.just(response);
            })
            .build();
        return new HistoryServiceQuoteStore(webClient, Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("a whole entry is posted to the price-check endpoint")
    void postsEntry() {
        HistoryServiceQuoteStore store = store(ClientResponse.create(HttpStatus.OK).build());
        List<Quote> quotes = List.of(Quote.of("ninja", 180.0, 300, false));
        PriceDecision decision = new PriceDecision(180.0, Confidence.MEDIUM, "ninja only", quotes);

        store.saveEntry(new LedgerEntry(DIVINE, SETTLERS, quotes, decision, null));

        assertEquals(HttpMethod.POST, seen.get().method());
        assertEquals("/api/v1/history/price-checks", seen.get().url().getPath());
    }

    @Test
    @DisplayName("recent quotes are read back from the quotes endpoint")
    void loadsRecentQuotes() {
        HistoryServiceQuoteStore store = store(ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body("""
                [ {"sourceId": "ninja", "chaosValue": 181.0, "sampleSize": 300,
                   "lowConfidence": false, "fetchedAt": "2026-01-01T00:00:00Z"} ]
                """)
            .build());

        List<Quote> quotes = store.loadRecentQuotes(DIVINE, SETTLERS, 5);

        assertEquals(1, quotes.size());
        assertEquals(181.0, quotes.get(0).chaosValue());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), quotes.get(0).fetchedAt());
        assertEquals("/api/v1/history/quotes", seen.get().url().getPath());
        assertTrue(seen.get().url().getQuery().contains("item=Divine Orb"));
        assertTrue(seen.get().url().getQuery().contains("limit=5"));
    }

    @Test
    @DisplayName("an error status from history-service surfaces as an exception")
    void errorStatus() {
        HistoryServiceQuoteStore store = store(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());

        assertThrows(RuntimeException.class,
            () -> store.saveDecision(DIVINE, SETTLERS, PriceDecision.notFound()));
    }
}

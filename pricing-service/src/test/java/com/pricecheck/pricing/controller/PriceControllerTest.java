package com.pricecheck.pricing.controller;

import com.pricecheck.common.model.Confidence;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;
import com.pricecheck.pricing.client.ResponseCache;
import com.pricecheck.pricing.client.SourceClients;
import com.pricecheck.pricing.engine.ArbitrationEngine;
import com.pricecheck.pricing.engine.DivineValueConverter;
import com.pricecheck.pricing.ledger.QuoteLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class PriceControllerTest {

    private ArbitrationEngine engine;
    private SourceClients sourceClients;
    private DivineValueConverter divineConverter;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        engine        = mock(ArbitrationEngine.class);
        sourceClients = mock(SourceClients.class);
        divineConverter = mock(DivineValueConverter.class);
        when(divineConverter.divineRate(any())).thenReturn(Optional.empty());
        QuoteLedger ledger = mock(QuoteLedger.class);
        client = WebTestClient.bindToController(new PriceController(engine, ledger, sourceClients, divineConverter))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("resolve returns the engine's decision")
    void resolve() {
        Quote quote = Quote.of("ninja", 180.5, 312, false);
        when(engine.resolvePrice(any(), any()))
            .thenReturn(new PriceDecision(180.5, Confidence.MEDIUM, "ninja only", List.of(quote)));

        client.get().uri("/api/v1/price/resolve?name=Mageblood&rarity=UNIQUE&league=Settlers")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.chaosValue").isEqualTo(180.5)
            .jsonPath("$.confidence").isEqualTo("MEDIUM")
            .jsonPath("$.decisionSource").isEqualTo("ninja only")
            .jsonPath("$.contributingQuotes[0].sourceId").isEqualTo("ninja");

        ArgumentCaptor<ItemIdentity> identity = ArgumentCaptor.forClass(ItemIdentity.class);
        verify(engine).resolvePrice(identity.capture(), any());
        assertEquals("Mageblood", identity.getValue().name());
    }

    @Test
    @DisplayName("resolve adds the value in divines when a rate is known")
    void resolveWithDivineValue() {
        when(engine.resolvePrice(any(), any()))
            .thenReturn(new PriceDecision(90.0, Confidence.HIGH, "ninja, validated by watch",
                                          List.of(Quote.of("ninja", 90.0, 40, false), Quote.of("watch", 92.0, 8, false))));
        when(divineConverter.divineRate(any())).thenReturn(Optional.of(180.0));

        client.get().uri("/api/v1/price/resolve?name=Mageblood&rarity=UNIQUE&league=Settlers")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.chaosValue").isEqualTo(90.0)
            .jsonPath("$.divineValue").isEqualTo(0.5)
            .jsonPath("$.divineRate").isEqualTo(180.0);
    }

    @Test
    @DisplayName("nothing found → no divine value and no rate lookup")
    void notFoundSkipsConversion() {
        when(engine.resolvePrice(any(), any())).thenReturn(PriceDecision.notFound());

        client.get().uri("/api/v1/price/resolve?name=Mageblood&rarity=UNIQUE&league=Settlers")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.confidence").isEqualTo("NONE")
            .jsonPath("$.divineValue").doesNotExist();

        verify(divineConverter, never()).divineRate(any());
    }

    @Test
    @DisplayName("missing name and base type → 400 without calling the engine")
    void invalidIdentity() {
        client.get().uri("/api/v1/price/resolve?league=Settlers")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error_code").isEqualTo("INVALID_IDENTITY");

        verifyNoInteractions(engine);
    }

    @Test
    @DisplayName("unknown rarity → 400")
    void badRarity() {
        client.get().uri("/api/v1/price/resolve?name=Mageblood&rarity=SHINY&league=Settlers")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("cache stats are reported per source")
    void cacheStats() {
        when(sourceClients.cacheStats()).thenReturn(Map.of("ninja", new ResponseCache.CacheStats(3, 10, 4, 1)));

        client.get().uri("/api/v1/price/cache-stats")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.ninja.size").isEqualTo(3)
            .jsonPath("$.ninja.hits").isEqualTo(10);
    }
}

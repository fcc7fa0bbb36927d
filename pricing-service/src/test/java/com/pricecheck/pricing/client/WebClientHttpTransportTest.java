package com.pricecheck.pricing.client;

import com.pricecheck.common.exception.TransientSourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class WebClientHttpTransportTest {

    private static WebClientHttpTransport transport(ExchangeFunction exchange, Duration timeout) {
        WebClient webClient = WebClient.builder()
            .baseUrl("https://api.poe.watch")
            .exchangeFunction(exchange)
            .build();
        return new WebClientHttpTransport("watch", webClient, timeout);
    }

    @Test
    @DisplayName("status, body and query parameters are passed through")
    void passesThrough() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        WebClientHttpTransport transport = transport(request -> {
            seen.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK).body("[]").build());
        }, Duration.ofSeconds(5));

        Map<String, String> params = new LinkedHashMap<>();
        params.put("league", "Settlers");
        params.put("q", "Shavronne's Wrappings");
        TransportResponse response = transport.execute(HttpMethod.GET, "/search", params);

        assertEquals(200, response.status());
        assertEquals("[]", response.body());
        assertTrue(response.retryAfterHint().isEmpty());
        assertEquals("/search", seen.get().url().getPath());
        assertTrue(seen.get().url().getQuery().contains("q=Shavronne's Wrappings"));
        assertFalse(seen.get().url().getRawQuery().contains(" "));
    }

    @Test
    @DisplayName("Retry-After seconds are surfaced on a 429")
    void retryAfter() {
        WebClientHttpTransport transport = transport(request -> Mono.just(
            ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).header("Retry-After", "5").build()),
            Duration.ofSeconds(5));

        TransportResponse response = transport.execute(HttpMethod.GET, "/search", Map.of());

        assertEquals(429, response.status());
        assertEquals("", response.body());
        assertEquals(Duration.ofSeconds(5), response.retryAfterHint().orElseThrow());
    }

    @Test
    @DisplayName("connection failures become transient source failures")
    void connectionFailure() {
        WebClientHttpTransport transport = transport(
            request -> Mono.error(new ConnectException("Connection refused")), Duration.ofSeconds(5));

        TransientSourceException e = assertThrows(TransientSourceException.class,
            () -> transport.execute(HttpMethod.GET, "/search", Map.of()));
        assertEquals("watch", e.getSourceId());
        assertInstanceOf(ConnectException.class, e.getCause());
    }

    @Test
    @DisplayName("a response slower than the timeout is a transient failure")
    void timeout() {
        WebClientHttpTransport transport = transport(request -> Mono.never(), Duration.ofMillis(100));

        TransientSourceException e = assertThrows(TransientSourceException.class,
            () -> transport.execute(HttpMethod.GET, "/search", Map.of()));
        assertInstanceOf(TimeoutException.class, e.getCause());
    }

    @Test
    @DisplayName("only delta-seconds Retry-After values are understood")
    void parseRetryAfter() {
        assertEquals(Duration.ofSeconds(120), WebClientHttpTransport.parseRetryAfter(" 120 "));
        assertNull(WebClientHttpTransport.parseRetryAfter("Wed, 21 Oct 2026 07:28:00 GMT"));
        assertNull(WebClientHttpTransport.parseRetryAfter("-1"));
        assertNull(WebClientHttpTransport.parseRetryAfter(null));
    }
}

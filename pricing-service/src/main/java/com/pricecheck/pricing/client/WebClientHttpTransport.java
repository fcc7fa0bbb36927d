package com.pricecheck.pricing.client;

import com.pricecheck.common.exception.TransientSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * {@link HttpTransport} over a Spring {@link WebClient} bound to one source's base URL.
 *
 * <p>The reactive exchange is blocked on: callers already run on a bounded-elastic worker.
 */
public class WebClientHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientHttpTransport.class);

    private final String sourceId;
    private final WebClient webClient;
    private final Duration timeout;

    public WebClientHttpTransport(String sourceId, WebClient webClient, Duration timeout) {
        this.sourceId  = sourceId;
        this.webClient = webClient;
        this.timeout   = timeout;
    }

    @Override
    public TransportResponse execute(HttpMethod method, String path, Map<String, String> params) {
        // query values go through URI variables so they are fully encoded
        Map<String, String> variables = new HashMap<>(params);
        try {
            return webClient.method(method)
                .uri(builder -> {
                    builder.path(path);
                    params.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
                    return builder.build(variables);
                })
                .exchangeToMono(response -> response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(body -> new TransportResponse(
                        response.statusCode().value(),
                        body,
                        parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER)))))
                .timeout(timeout)
                .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.debug("Transport failure. source={} path={} error={}", sourceId, path, cause.toString());
            throw new TransientSourceException(sourceId, "Request to " + path + " failed: " + cause, cause);
        }
    }

    /**
     * Only the delta-seconds form is understood; an HTTP-date hint is ignored.
     */
    static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

package com.pricecheck.pricing.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricecheck.common.exception.PermanentSourceException;
import com.pricecheck.common.exception.PriceSourceException;
import com.pricecheck.common.exception.TransientSourceException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * Generic request executor for one external source: paced, cached and retried.
 *
 * <h3>Request lifecycle</h3>
 * <ol>
 *   <li>GET only: a live cache entry for {@code METHOD path?sorted-params} is returned with no
 *       network I/O and no rate-limit budget spent.</li>
 *   <li>Every attempt waits on the {@link IntervalRateLimiter}.</li>
 *   <li>Attempts are counted by a per-client resilience4j {@link Retry}; its interval function
 *       supplies the wait and the client sleeps through the injected {@link Sleeper}.</li>
 *   <li>2xx → body parsed as JSON; GET results are cached before returning.
 *       A body that is not JSON is a {@link PermanentSourceException} and is not cached.</li>
 *   <li>429, 5xx, timeouts and I/O errors are transient: retried up to {@code maxRetries}
 *       times with {@code min(base * 2^attempt, max)} plus up to 10% jitter. A Retry-After hint
 *       (60 s when a 429 carries none) replaces the computed delay.</li>
 *   <li>Any other status ≥ 400 fails at once with {@link PermanentSourceException}.</li>
 *   <li>When retries are exhausted the last transient failure is wrapped in a
 *       {@link PermanentSourceException}.</li>
 * </ol>
 *
 * <p>Knows nothing about items or prices; adapters interpret the returned tree.
 */
public class RateLimitedCachingClient {

    private static final Logger log = LoggerFactory.getLogger(RateLimitedCachingClient.class);

    static final Duration DEFAULT_RATE_LIMIT_WAIT = Duration.ofSeconds(60);
    private static final double JITTER_FRACTION  = 0.1;
    private static final int TOO_MANY_REQUESTS    = 429;

    private final String sourceId;
    private final HttpTransport transport;
    private final ObjectMapper objectMapper;
    private final ClientSettings settings;
    private final IntervalRateLimiter rateLimiter;
    private final ResponseCache<JsonNode> cache;
    private final Sleeper sleeper;
    private final DoubleSupplier jitter;
    private final Retry retry;

    public RateLimitedCachingClient(String sourceId, HttpTransport transport,
                                    ObjectMapper objectMapper, ClientSettings settings) {
        this(sourceId, transport, objectMapper, settings, Sleeper.THREAD, Clock.systemUTC(),
             System::nanoTime, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Full constructor; the sleeper, clocks and jitter source are replaceable for tests.
     *
     * @param jitter supplies values in {@code [0, 1)}
     */
    public RateLimitedCachingClient(String sourceId, HttpTransport transport, ObjectMapper objectMapper,
                                    ClientSettings settings, Sleeper sleeper, Clock clock,
                                    LongSupplier nanoTime, DoubleSupplier jitter) {
        this.sourceId     = sourceId;
        this.transport    = transport;
        this.objectMapper = objectMapper;
        this.settings     = settings;
        this.sleeper      = sleeper;
        this.jitter       = jitter;
        this.rateLimiter  = new IntervalRateLimiter(settings.requestsPerSecond(), nanoTime, sleeper);
        this.cache        = new ResponseCache<>(settings.cacheTtl(), settings.maxCacheEntries(), clock);
        this.retry        = Retry.of(sourceId, retryConfig());
        this.retry.getEventPublisher().onRetry(event ->
            log.warn("Transient failure, retrying. source={} attempt={}/{} delayMs={} reason={}",
                     sourceId, event.getNumberOfRetryAttempts(), maxAttempts(),
                     event.getWaitInterval().toMillis(), event.getLastThrowable().getMessage()));
    }

    private RetryConfig retryConfig() {
        return RetryConfig.<JsonNode>custom()
            .maxAttempts(maxAttempts())
            .retryOnException(e -> e instanceof PriceSourceException && ((PriceSourceException) e).isRetryable())
            .intervalBiFunction((attempt, outcome) -> retryDelay(attempt, outcome.isLeft() ? outcome.getLeft() : null)
                .toMillis())
            .build();
    }

    private int maxAttempts() {
        return settings.maxRetries() + 1;
    }

    /**
     * Delay before the retry that follows failed attempt {@code attempt} (1-based). A Retry-After
     * hint on the failure wins over the exponential backoff.
     */
    Duration retryDelay(int attempt, Throwable failure) {
        if (failure instanceof TransientSourceException) {
            Optional<Duration> retryAfter = ((TransientSourceException) failure).getRetryAfter();
            if (retryAfter.isPresent()) {
                return retryAfter.get();
            }
        }
        return backoff(attempt - 1);
    }

    public JsonNode get(String path, Map<String, String> params) {
        return request(HttpMethod.GET, path, params);
    }

    /**
     * @throws PermanentSourceException on a non-retryable status, malformed body, exhausted
     *                                  retries or interruption
     */
    public JsonNode request(HttpMethod method, String path, Map<String, String> params) {
        Map<String, String> query = params == null ? Map.of() : params;
        boolean cacheable = HttpMethod.GET.equals(method);
        String key = cacheKey(method, path, query);

        if (cacheable) {
            JsonNode cached = cache.get(key).orElse(null);
            if (cached != null) {
                log.debug("CACHE_HIT source={} key={}", sourceId, key);
                return cached;
            }
            log.debug("CACHE_MISS source={} key={}", sourceId, key);
        }

        Retry.AsyncContext<JsonNode> context = retry.asyncContext();
        while (true) {
            try {
                rateLimiter.acquire();
                JsonNode body = attemptOnce(method, path, query);
                context.onComplete();
                if (cacheable) {
                    cache.put(key, body);
                }
                return body;
            } catch (TransientSourceException e) {
                // the async context hands back the wait instead of sleeping itself; -1 means exhausted
                long delayMillis = context.onError(e);
                if (delayMillis < 0) {
                    log.error("Retries exhausted. source={} key={} attempts={}", sourceId, key, maxAttempts());
                    throw new PermanentSourceException(sourceId,
                        "Gave up after " + maxAttempts() + " attempts: " + e.getReason(), e);
                }
                try {
                    sleeper.sleep(Duration.ofMillis(delayMillis));
                } catch (InterruptedException ie) {
                    throw interrupted(ie);
                }
            } catch (InterruptedException ie) {
                throw interrupted(ie);
            }
        }
    }

    public ResponseCache.CacheStats cacheStats() {
        return cache.stats();
    }

    public void clearCache() {
        cache.clear();
    }

    public int cacheSize() {
        return cache.size();
    }

    public String getSourceId() {
        return sourceId;
    }

    private JsonNode attemptOnce(HttpMethod method, String path, Map<String, String> query) {
        TransportResponse response = transport.execute(method, path, query);
        int status = response.status();

        if (status == TOO_MANY_REQUESTS) {
            Duration wait = response.retryAfterHint().orElse(DEFAULT_RATE_LIMIT_WAIT);
            throw new TransientSourceException(sourceId, "Rate limited by source (429)", wait, null);
        }
        if (status >= 500) {
            throw new TransientSourceException(sourceId, "Server error " + status,
                                               response.retryAfter(), null);
        }
        if (status >= 400) {
            throw new PermanentSourceException(sourceId, "Request to " + path + " rejected with status " + status);
        }
        if (!response.isSuccess()) {
            throw new PermanentSourceException(sourceId, "Unexpected status " + status + " from " + path);
        }

        try {
            JsonNode tree = objectMapper.readTree(response.body());
            if (tree == null || tree.isMissingNode()) {
                throw new PermanentSourceException(sourceId, "Empty response body from " + path);
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new PermanentSourceException(sourceId, "Malformed JSON from " + path, e);
        }
    }

    Duration backoff(int attempt) {
        long base   = settings.baseBackoff().toMillis();
        long capped = Math.min(base << Math.min(attempt, 30), settings.maxBackoff().toMillis());
        long spread = (long) (capped * JITTER_FRACTION * jitter.getAsDouble());
        return Duration.ofMillis(capped + spread);
    }

    private PermanentSourceException interrupted(InterruptedException e) {
        Thread.currentThread().interrupt();
        return new PermanentSourceException(sourceId, "Interrupted while waiting", e);
    }

    static String cacheKey(HttpMethod method, String path, Map<String, String> params) {
        if (params.isEmpty()) {
            return method.name() + " " + path;
        }
        String query = new TreeMap<>(params).entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("&"));
        return method.name() + " " + path + "?" + query;
    }
}

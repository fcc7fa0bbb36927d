package com.pricecheck.pricing.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricecheck.common.arbitration.ArbitrationStrategy;
import com.pricecheck.common.arbitration.DivergenceArbitrationStrategy;
import com.pricecheck.common.ledger.QuoteStore;
import com.pricecheck.common.model.Game;
import com.pricecheck.pricing.adapter.DivineRateSource;
import com.pricecheck.pricing.adapter.NinjaSourceAdapter;
import com.pricecheck.pricing.adapter.PoeWatchSourceAdapter;
import com.pricecheck.pricing.adapter.SourceAdapter;
import com.pricecheck.pricing.client.ClientSettings;
import com.pricecheck.pricing.client.RateLimitedCachingClient;
import com.pricecheck.pricing.client.SourceClients;
import com.pricecheck.pricing.client.WebClientHttpTransport;
import com.pricecheck.pricing.engine.ArbitrationEngine;
import com.pricecheck.pricing.engine.DivineValueConverter;
import com.pricecheck.pricing.ledger.HistoryServiceQuoteStore;
import com.pricecheck.pricing.ledger.QuoteLedger;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Wires the pricing pipeline: one WebClient, client and adapter per enabled source, then the
 * engine over them in registration order (ninja, poe2ninja, watch).
 *
 * <p>Per-source keys live under {@code pricing.sources.<id>.*}; a source with
 * {@code enabled: false} is not registered at all.
 */
@Configuration
public class PricingConfig {

    private static final Logger log = LoggerFactory.getLogger(PricingConfig.class);

    @Value("${pricing.http.user-agent:PriceCheck/1.0}")
    private String userAgent;

    @Value("${pricing.http.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${pricing.http.response-timeout-seconds:10}")
    private int responseTimeoutSeconds;

    @Value("${pricing.retry.base-delay-ms:1000}")
    private long baseDelayMs;

    @Value("${pricing.retry.max-delay-ms:60000}")
    private long maxDelayMs;

    @Value("${pricing.arbitration.divergence-threshold:0.20}")
    private double divergenceThreshold;

    @Value("${pricing.arbitration.primary-source:ninja}")
    private String primarySource;

    @Value("${pricing.arbitration.lookup-timeout-seconds:30}")
    private long lookupTimeoutSeconds;

    @Value("${pricing.conversion.poe1-divine-rate:0}")
    private double poe1DivineRate;

    @Value("${pricing.conversion.poe2-divine-rate:0}")
    private double poe2DivineRate;

    @Value("${history-service.base-url:http://localhost:8084}")
    private String historyBaseUrl;

    @Bean
    public RegisteredSources registeredSources(WebClient.Builder builder, ObjectMapper objectMapper, Environment env) {
        List<SourceAdapter> adapters = new ArrayList<>();
        List<RateLimitedCachingClient> clients = new ArrayList<>();

        for (NinjaSourceAdapter.Edition edition : NinjaSourceAdapter.Edition.values()) {
            String defaultUrl = edition == NinjaSourceAdapter.Edition.POE1
                ? "https://poe.ninja/api/data"
                : "https://poe2.ninja/api/data";
            RateLimitedCachingClient client = sourceClient(edition.sourceId(), defaultUrl, 0.33,
                                                           builder, objectMapper, env);
            if (client != null) {
                clients.add(client);
                adapters.add(new NinjaSourceAdapter(edition, client));
            }
        }

        RateLimitedCachingClient watchClient = sourceClient(PoeWatchSourceAdapter.SOURCE_ID,
                                                            "https://api.poe.watch", 0.5,
                                                            builder, objectMapper, env);
        if (watchClient != null) {
            clients.add(watchClient);
            adapters.add(new PoeWatchSourceAdapter(watchClient));
        }

        log.info("Price sources registered. sources={}", adapters.stream().map(SourceAdapter::sourceId).toList());
        return new RegisteredSources(adapters, clients);
    }

    @Bean
    public SourceClients sourceClients(RegisteredSources sources) {
        return new SourceClients(sources.clients());
    }

    /**
     * Divine conversion reads the ninja currency overviews; a positive configured rate for a
     * game takes precedence.
     */
    @Bean
    public DivineValueConverter divineValueConverter(RegisteredSources sources) {
        List<DivineRateSource> rateSources = sources.adapters().stream()
            .filter(DivineRateSource.class::isInstance)
            .map(DivineRateSource.class::cast)
            .toList();
        Map<Game, Double> overrides = new EnumMap<>(Game.class);
        overrides.put(Game.POE1, poe1DivineRate);
        overrides.put(Game.POE2, poe2DivineRate);
        return new DivineValueConverter(rateSources, overrides);
    }

    @Bean
    public ArbitrationStrategy arbitrationStrategy() {
        return new DivergenceArbitrationStrategy(divergenceThreshold, primarySource);
    }

    @Bean
    public QuoteStore quoteStore(WebClient.Builder builder) {
        WebClient historyClient = builder.clone().baseUrl(historyBaseUrl).build();
        return new HistoryServiceQuoteStore(historyClient, Duration.ofSeconds(responseTimeoutSeconds));
    }

    @Bean
    public QuoteLedger quoteLedger(QuoteStore quoteStore) {
        return new QuoteLedger(quoteStore);
    }

    @Bean
    public ArbitrationEngine arbitrationEngine(RegisteredSources sources, ArbitrationStrategy strategy,
                                               QuoteLedger ledger) {
        return new ArbitrationEngine(sources.adapters(), strategy, ledger,
                                     Duration.ofSeconds(lookupTimeoutSeconds));
    }

    // ── per-source construction ──────────────────────────────────────────────

    private RateLimitedCachingClient sourceClient(String sourceId, String defaultUrl, double defaultRate,
                                                  WebClient.Builder builder, ObjectMapper objectMapper,
                                                  Environment env) {
        String prefix = "pricing.sources." + sourceId + ".";
        if (!env.getProperty(prefix + "enabled", Boolean.class, true)) {
            log.info("Price source disabled. source={}", sourceId);
            return null;
        }
        String baseUrl = env.getProperty(prefix + "base-url", defaultUrl);
        ClientSettings settings = new ClientSettings(
            env.getProperty(prefix + "requests-per-second", Double.class, defaultRate),
            Duration.ofSeconds(env.getProperty(prefix + "cache-ttl-seconds", Long.class, 3600L)),
            env.getProperty(prefix + "max-cache-entries", Integer.class, 1000),
            env.getProperty(prefix + "max-retries", Integer.class, 3),
            Duration.ofMillis(baseDelayMs),
            Duration.ofMillis(maxDelayMs));

        WebClient webClient = sourceWebClient(builder.clone(), baseUrl);
        WebClientHttpTransport transport = new WebClientHttpTransport(
            sourceId, webClient, Duration.ofSeconds(responseTimeoutSeconds));
        log.info("Price source configured. source={} baseUrl={} requestsPerSecond={} cacheTtlSeconds={}",
                 sourceId, baseUrl, settings.requestsPerSecond(), settings.cacheTtl().toSeconds());
        return new RateLimitedCachingClient(sourceId, transport, objectMapper, settings);
    }

    private WebClient sourceWebClient(WebClient.Builder builder, String baseUrl) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}

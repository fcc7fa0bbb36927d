package com.pricecheck.pricing.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricecheck.common.exception.PermanentSourceException;
import com.pricecheck.common.matching.ItemNameNormalizer;
import com.pricecheck.common.model.Game;
import com.pricecheck.common.model.ItemIdentity;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.common.model.Quote;
import com.pricecheck.common.model.Rarity;
import com.pricecheck.pricing.client.RateLimitedCachingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Adapter for the poe.watch search API (PoE1 only).
 *
 * <p>{@code search?league=&q=} returns every variant of the queried name: linked and unlinked
 * uniques, gem levels and so on. Candidates are the results whose name matches exactly after
 * normalization. For uniques with a known base type, matching bases win; unlinked variants win
 * over linked ones. Among the remaining candidates the highest {@code mean} is taken.
 *
 * <p>{@code daily} (listings seen in the last day) becomes the sample size and the service's own
 * {@code lowConfidence} flag is carried through.
 */
public class PoeWatchSourceAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(PoeWatchSourceAdapter.class);

    public static final String SOURCE_ID = "watch";

    private final RateLimitedCachingClient client;

    public PoeWatchSourceAdapter(RateLimitedCachingClient client) {
        this.client = client;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public boolean supports(Game game) {
        return game == Game.POE1;
    }

    @Override
    public Optional<Quote> findQuote(ItemIdentity identity, MarketContext market) {
        if (!supports(market.game()) || !identity.isValid() || !identity.rarity().isDirectlyPriceable()) {
            return Optional.empty();
        }
        String query = identity.displayName();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("league", market.league());
        params.put("q", query);
        JsonNode results = client.get("/search", params);
        if (!results.isArray()) {
            throw new PermanentSourceException(SOURCE_ID, "Unexpected search response for '" + query + "'");
        }

        List<JsonNode> candidates = new ArrayList<>();
        for (JsonNode result : results) {
            if (ItemNameNormalizer.matches(query, JsonValues.text(result, "name"))
                    && JsonValues.firstPrice(result, "mean").isPresent()) {
                candidates.add(result);
            }
        }
        if (identity.rarity() == Rarity.UNIQUE && identity.hasBaseType()) {
            candidates = preferred(candidates, r -> ItemNameNormalizer.matches(identity.baseType(), baseTypeOf(r)));
        }
        candidates = preferred(candidates, r -> JsonValues.firstCount(r, "linkCount") == 0);

        JsonNode best = null;
        double bestMean = -1.0;
        for (JsonNode candidate : candidates) {
            double mean = JsonValues.firstPrice(candidate, "mean").orElse(0.0);
            if (mean > bestMean) {
                best     = candidate;
                bestMean = mean;
            }
        }
        if (best == null) {
            log.debug("No listing. source={} item={} league={}", SOURCE_ID, query, market.league());
            return Optional.empty();
        }

        int daily = JsonValues.firstCount(best, "daily");
        boolean lowConfidence = best.path("lowConfidence").asBoolean(false);
        log.info("Quote found. source={} value={} daily={} lowConfidence={}", SOURCE_ID, bestMean, daily, lowConfidence);
        return Optional.of(Quote.of(SOURCE_ID, bestMean, daily, lowConfidence));
    }

    /**
     * Narrows to the candidates satisfying {@code preference}, or keeps them all if none does.
     */
    private static List<JsonNode> preferred(List<JsonNode> candidates, Predicate<JsonNode> preference) {
        List<JsonNode> matching = new ArrayList<>();
        for (JsonNode candidate : candidates) {
            if (preference.test(candidate)) {
                matching.add(candidate);
            }
        }
        return matching.isEmpty() ? candidates : matching;
    }

    private static String baseTypeOf(JsonNode result) {
        String baseType = JsonValues.text(result, "baseType");
        return baseType != null ? baseType : JsonValues.text(result, "type");
    }
}

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

/**
 * Adapter for the poe.ninja economy API and its PoE2 twin, which share one response format.
 *
 * <p>Prices come from overview endpoints that list a whole item type per league:
 * {@code currencyoverview?type=Currency} for currency and {@code itemoverview?type=...} for
 * everything else. Overviews are cached by the client, so resolving several items of one type
 * costs a single request per cache period.
 *
 * <p>Values are in the edition's base currency: chaos for PoE1, exalted for PoE2. The base
 * currency itself is not listed by the API and is answered as exactly 1 without a request.
 */
public class NinjaSourceAdapter implements SourceAdapter, DivineRateSource {

    private static final Logger log = LoggerFactory.getLogger(NinjaSourceAdapter.class);

    private static final String CURRENCY_TYPE = "Currency";
    private static final String DIVINE_ORB    = "Divine Orb";
    private static final List<String> UNIQUE_TYPES = List.of(
        "UniqueWeapon", "UniqueArmour", "UniqueAccessory", "UniqueFlask", "UniqueJewel");

    /** Category hint (normalized) → overview type. */
    private static final Map<String, String> CATEGORY_TYPES = new LinkedHashMap<>();
    static {
        CATEGORY_TYPES.put("currency",         CURRENCY_TYPE);
        CATEGORY_TYPES.put("fragment",         "Fragment");
        CATEGORY_TYPES.put("map fragment",     "Fragment");
        CATEGORY_TYPES.put("divination card",  "DivinationCard");
        CATEGORY_TYPES.put("card",             "DivinationCard");
        CATEGORY_TYPES.put("essence",          "Essence");
        CATEGORY_TYPES.put("fossil",           "Fossil");
        CATEGORY_TYPES.put("scarab",           "Scarab");
        CATEGORY_TYPES.put("oil",              "Oil");
        CATEGORY_TYPES.put("incubator",        "Incubator");
        CATEGORY_TYPES.put("vial",             "Vial");
        CATEGORY_TYPES.put("gem",              "SkillGem");
        CATEGORY_TYPES.put("skill gem",        "SkillGem");
        CATEGORY_TYPES.put("rune",             "Rune");
        CATEGORY_TYPES.put("soul core",        "SoulCore");
    }

    public enum Edition {
        POE1("ninja", Game.POE1, "Chaos Orb",
             List.of(CURRENCY_TYPE, "Fragment", "DivinationCard", "Essence", "Fossil",
                     "Scarab", "Oil", "Incubator", "Vial"),
             List.of("chaosEquivalent"),
             List.of("chaosValue")),
        POE2("poe2ninja", Game.POE2, "Exalted Orb",
             List.of(CURRENCY_TYPE, "SkillGem", "Rune", "SoulCore"),
             List.of("exaltedValue", "chaosEquivalent"),
             List.of("exaltedValue", "chaosValue"));

        private final String sourceId;
        private final Game game;
        private final String referenceCurrency;
        private final List<String> stackableTypes;
        private final String[] currencyValueFields;
        private final String[] itemValueFields;

        Edition(String sourceId, Game game, String referenceCurrency, List<String> stackableTypes,
                List<String> currencyValueFields, List<String> itemValueFields) {
            this.sourceId            = sourceId;
            this.game                = game;
            this.referenceCurrency   = referenceCurrency;
            this.stackableTypes      = stackableTypes;
            this.currencyValueFields = currencyValueFields.toArray(new String[0]);
            this.itemValueFields     = itemValueFields.toArray(new String[0]);
        }

        public String sourceId() {
            return sourceId;
        }

        public Game game() {
            return game;
        }

        /** The currency every value of this edition is expressed in. */
        public String referenceCurrency() {
            return referenceCurrency;
        }

        List<String> stackableTypes() {
            return stackableTypes;
        }
    }

    private final Edition edition;
    private final RateLimitedCachingClient client;

    public NinjaSourceAdapter(Edition edition, RateLimitedCachingClient client) {
        this.edition = edition;
        this.client  = client;
    }

    @Override
    public String sourceId() {
        return edition.sourceId();
    }

    @Override
    public boolean supports(Game game) {
        return edition.game() == game;
    }

    @Override
    public Optional<Quote> findQuote(ItemIdentity identity, MarketContext market) {
        if (!supports(market.game()) || !identity.isValid() || !identity.rarity().isDirectlyPriceable()) {
            return Optional.empty();
        }
        if (identity.rarity() != Rarity.UNIQUE
                && ItemNameNormalizer.matches(edition.referenceCurrency(), identity.displayName())) {
            return Optional.of(Quote.of(sourceId(), 1.0, 0, false));
        }
        Optional<Quote> quote = identity.rarity() == Rarity.UNIQUE
            ? findUnique(identity, market)
            : findStackable(identity, market);
        if (quote.isEmpty()) {
            log.debug("No listing. source={} item={} league={}", sourceId(), identity.displayName(), market.league());
        }
        return quote;
    }

    /**
     * Reads the Divine Orb line of the league's currency overview. The overview is the one
     * {@link #findQuote} uses, so this normally costs no extra request.
     */
    @Override
    public Optional<Double> divineRate(MarketContext market) {
        if (!supports(market.game())) {
            return Optional.empty();
        }
        for (JsonNode line : lines(CURRENCY_TYPE, market)) {
            String lineName = firstNonNull(JsonValues.text(line, "currencyTypeName"), JsonValues.text(line, "name"));
            if (ItemNameNormalizer.matches(DIVINE_ORB, lineName)) {
                Optional<Double> rate = JsonValues.firstPrice(line, edition.currencyValueFields)
                    .filter(value -> value > 0.0);
                rate.ifPresent(value -> log.info("Divine rate read. source={} league={} rate={}",
                                                 sourceId(), market.league(), value));
                return rate;
            }
        }
        log.warn("Divine Orb missing from currency overview. source={} league={}", sourceId(), market.league());
        return Optional.empty();
    }

    // ── uniques ──────────────────────────────────────────────────────────────

    private Optional<Quote> findUnique(ItemIdentity identity, MarketContext market) {
        String name = identity.name();
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        for (String type : UNIQUE_TYPES) {
            JsonNode firstNameMatch = null;
            for (JsonNode line : lines(type, market)) {
                if (!ItemNameNormalizer.matches(name, JsonValues.text(line, "name"))) {
                    continue;
                }
                if (identity.hasBaseType()
                        && ItemNameNormalizer.matches(identity.baseType(), JsonValues.text(line, "baseType"))) {
                    return toQuote(line, false);
                }
                if (firstNameMatch == null) {
                    firstNameMatch = line;
                }
            }
            if (firstNameMatch != null) {
                return toQuote(firstNameMatch, false);
            }
        }
        return Optional.empty();
    }

    // ── currency-like items ──────────────────────────────────────────────────

    private Optional<Quote> findStackable(ItemIdentity identity, MarketContext market) {
        String wanted = identity.displayName();
        for (String type : typesFor(identity)) {
            boolean currencyLines = CURRENCY_TYPE.equals(type);
            for (JsonNode line : lines(type, market)) {
                String lineName = currencyLines
                    ? firstNonNull(JsonValues.text(line, "currencyTypeName"), JsonValues.text(line, "name"))
                    : JsonValues.text(line, "name");
                if (ItemNameNormalizer.matches(wanted, lineName)) {
                    return toQuote(line, currencyLines);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Overview types worth searching for a non-unique identity. A category, rarity or name hint
     * narrows the search to one type; without any hint every stackable type of the edition is
     * searched in declaration order.
     */
    List<String> typesFor(ItemIdentity identity) {
        List<String> hinted = new ArrayList<>();
        if (identity.hasCategory()) {
            String type = CATEGORY_TYPES.get(ItemNameNormalizer.normalize(identity.category()));
            addIfServed(hinted, type);
        }
        if (hinted.isEmpty()) {
            switch (identity.rarity()) {
                case CURRENCY        -> addIfServed(hinted, CURRENCY_TYPE);
                case DIVINATION_CARD -> addIfServed(hinted, "DivinationCard");
                case GEM             -> addIfServed(hinted, "SkillGem");
                default              -> { }
            }
        }
        if (hinted.isEmpty()) {
            String lowerName = ItemNameNormalizer.normalize(identity.displayName());
            if (lowerName.contains("soul core") || lowerName.contains("soulcore")) {
                addIfServed(hinted, "SoulCore");
            } else if (lowerName.contains("rune")) {
                addIfServed(hinted, "Rune");
            }
        }
        return hinted.isEmpty() ? edition.stackableTypes() : hinted;
    }

    private void addIfServed(List<String> types, String type) {
        if (type != null && edition.stackableTypes().contains(type)) {
            types.add(type);
        }
    }

    // ── response handling ────────────────────────────────────────────────────

    private Iterable<JsonNode> lines(String type, MarketContext market) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("league", market.league());
        params.put("type", type);
        if (edition == Edition.POE2) {
            params.put("language", "en");
        }
        String endpoint = CURRENCY_TYPE.equals(type) ? "/currencyoverview" : "/itemoverview";
        JsonNode root = client.get(endpoint, params);
        if (!root.isObject()) {
            throw new PermanentSourceException(sourceId(),
                "Unexpected " + endpoint + " response for type " + type);
        }
        return root.path("lines");
    }

    private Optional<Quote> toQuote(JsonNode line, boolean currencyLine) {
        String[] valueFields = currencyLine ? edition.currencyValueFields : edition.itemValueFields;
        Optional<Double> value = JsonValues.firstPrice(line, valueFields);
        if (value.isEmpty()) {
            log.debug("Listing without price. source={} line={}", sourceId(), line.path("name").asText(""));
            return Optional.empty();
        }
        int sampleSize = JsonValues.firstCount(line, "count", "listingCount");
        if (sampleSize == 0) {
            sampleSize = JsonValues.firstCount(line.path("receive"), "count", "listing_count");
        }
        Quote quote = Quote.of(sourceId(), value.get(), sampleSize, false);
        log.info("Quote found. source={} value={} sampleSize={}", sourceId(), quote.chaosValue(), sampleSize);
        return Optional.of(quote);
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}

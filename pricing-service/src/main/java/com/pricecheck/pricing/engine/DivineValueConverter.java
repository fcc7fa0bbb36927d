package com.pricecheck.pricing.engine;

import com.pricecheck.common.exception.PriceSourceException;
import com.pricecheck.common.model.Game;
import com.pricecheck.common.model.MarketContext;
import com.pricecheck.pricing.adapter.DivineRateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Expresses base-currency values in Divine Orbs for display.
 *
 * <p>The rate comes from a configured override for the game when one is set (a positive value),
 * otherwise from the first registered {@link DivineRateSource} serving the game. A source
 * failure leaves the value unconverted; it never fails the lookup.
 */
public class DivineValueConverter {

    private static final Logger log = LoggerFactory.getLogger(DivineValueConverter.class);

    private final List<DivineRateSource> sources;
    private final Map<Game, Double> overrides;

    public DivineValueConverter(List<DivineRateSource> sources, Map<Game, Double> overrides) {
        this.sources   = List.copyOf(sources);
        this.overrides = overrides.isEmpty() ? new EnumMap<>(Game.class) : new EnumMap<>(overrides);
    }

    public Optional<Double> divineRate(MarketContext market) {
        Double override = overrides.get(market.game());
        if (override != null && override > 0.0) {
            return Optional.of(override);
        }
        for (DivineRateSource source : sources) {
            if (!source.supports(market.game())) {
                continue;
            }
            try {
                Optional<Double> rate = source.divineRate(market);
                if (rate.isPresent()) {
                    return rate;
                }
            } catch (PriceSourceException e) {
                log.warn("Divine rate unavailable. source={} league={} reason={}",
                         e.getSourceId(), market.league(), e.getReason());
            }
        }
        return Optional.empty();
    }

    /**
     * @return {@code value / rate}; empty when no rate is known
     */
    public Optional<Double> toDivines(double value, MarketContext market) {
        return divineRate(market).map(rate -> value / rate);
    }
}

package com.pricecheck.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * League and game edition a lookup is scoped to. Prices are only comparable inside one league.
 */
public record MarketContext(
    @JsonProperty("league") String league,
    @JsonProperty("game")   Game game
) {
    public MarketContext {
        Objects.requireNonNull(game, "game");
        if (league == null || league.isBlank()) {
            throw new IllegalArgumentException("league must not be blank");
        }
        league = league.trim();
    }

    public static MarketContext poe1(String league) {
        return new MarketContext(league, Game.POE1);
    }

    public static MarketContext poe2(String league) {
        return new MarketContext(league, Game.POE2);
    }
}

package com.pricecheck.common.model;

/**
 * Game edition a league belongs to. Prices are expressed in the edition's base currency:
 * chaos orbs for {@link #POE1}, exalted orbs for {@link #POE2}.
 */
public enum Game {
    POE1,
    POE2
}

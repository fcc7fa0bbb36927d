package com.pricecheck.common.model;

public enum Rarity {
    NORMAL,
    MAGIC,
    RARE,
    UNIQUE,
    CURRENCY,
    GEM,
    DIVINATION_CARD,
    UNKNOWN;

    /** Rare and magic items need a valuation heuristic; no source can price them by name. */
    public boolean isDirectlyPriceable() {
        return this != RARE && this != MAGIC;
    }
}

package com.pricecheck.common.model;

/**
 * How strongly multi-source agreement supports a {@link PriceDecision} value.
 *
 * <p>{@code LOW} is part of the vocabulary shared with consumers; the divergence
 * arbitration never emits it.
 */
public enum Confidence {
    HIGH,
    MEDIUM,
    LOW,
    NONE
}

package com.pricecheck.common.arbitration;

import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;

import java.util.List;

/**
 * Strategy contract for reconciling the quotes of one lookup into a single {@link PriceDecision}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>     : no logging, no I/O, no reactive types</li>
 *   <li><b>Total</b>    : defined for 0, 1 and N quotes; never return {@code null}</li>
 * </ul>
 *
 * <p>Current implementation: {@link DivergenceArbitrationStrategy}.
 */
public interface ArbitrationStrategy {

    /**
     * @param quotes quotes in adapter registration order; may be empty, never {@code null}
     * @return the decision, carrying {@code quotes} unchanged as contributing quotes
     */
    PriceDecision decide(List<Quote> quotes);
}

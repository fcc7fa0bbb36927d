package com.pricecheck.common.arbitration;

import com.pricecheck.common.model.Confidence;
import com.pricecheck.common.model.PriceDecision;
import com.pricecheck.common.model.Quote;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Default {@link ArbitrationStrategy}: trust the primary source when every quote agrees with it,
 * average when they disagree.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>No quotes → {@code 0}, NONE, "not found".</li>
 *   <li>One quote → its value, MEDIUM, "{@code <source>} only". A lone source is never HIGH.</li>
 *   <li>Two or more → {@code relDiff = (max - min) / min}.
 *     <ul>
 *       <li>{@code relDiff <= threshold}, no low-confidence quote → primary value, HIGH,
 *           "{@code <primary>, validated by <others>}".</li>
 *       <li>{@code relDiff <= threshold}, some low-confidence quote → primary value, MEDIUM.</li>
 *       <li>otherwise → arithmetic mean, MEDIUM, "{@code averaged(<ids>)}".</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>{@code min == 0} counts as maximal divergence and always averages. A disagreeing source is
 * never dropped; disagreement only lowers confidence.
 *
 * <p>The primary is the configured source id when it is among the quotes, otherwise the first
 * quote in registration order.
 */
public class DivergenceArbitrationStrategy implements ArbitrationStrategy {

    public static final double DEFAULT_DIVERGENCE_THRESHOLD = 0.20;

    /** Absorbs binary rounding so that a spread of exactly the threshold counts as agreement. */
    static final double THRESHOLD_TOLERANCE = 1e-9;

    private final double divergenceThreshold;
    private final String primarySourceId;

    public DivergenceArbitrationStrategy(String primarySourceId) {
        this(DEFAULT_DIVERGENCE_THRESHOLD, primarySourceId);
    }

    public DivergenceArbitrationStrategy(double divergenceThreshold, String primarySourceId) {
        if (Double.isNaN(divergenceThreshold) || divergenceThreshold < 0.0) {
            throw new IllegalArgumentException("divergenceThreshold must be >= 0, got " + divergenceThreshold);
        }
        this.divergenceThreshold = divergenceThreshold;
        this.primarySourceId     = primarySourceId;
    }

    @Override
    public PriceDecision decide(List<Quote> quotes) {
        if (quotes == null || quotes.isEmpty()) {
            return PriceDecision.notFound();
        }
        if (quotes.size() == 1) {
            Quote only = quotes.get(0);
            return new PriceDecision(only.chaosValue(), Confidence.MEDIUM, only.sourceId() + " only", quotes);
        }

        if (relativeDifference(quotes) <= divergenceThreshold + THRESHOLD_TOLERANCE) {
            Quote primary = selectPrimary(quotes);
            boolean anyLowConfidence = quotes.stream().anyMatch(Quote::lowConfidence);
            String others = quotes.stream()
                .filter(q -> q != primary)
                .map(Quote::sourceId)
                .collect(Collectors.joining(", "));
            return new PriceDecision(
                primary.chaosValue(),
                anyLowConfidence ? Confidence.MEDIUM : Confidence.HIGH,
                primary.sourceId() + ", validated by " + others,
                quotes);
        }

        double sum = 0.0;
        for (Quote q : quotes) {
            sum += q.chaosValue();
        }
        String ids = quotes.stream().map(Quote::sourceId).collect(Collectors.joining(","));
        return new PriceDecision(sum / quotes.size(), Confidence.MEDIUM, "averaged(" + ids + ")", quotes);
    }

    public double getDivergenceThreshold() {
        return divergenceThreshold;
    }

    public String getPrimarySourceId() {
        return primarySourceId;
    }

    /**
     * {@code (max - min) / min}; positive infinity when {@code min == 0}.
     */
    static double relativeDifference(List<Quote> quotes) {
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (Quote q : quotes) {
            min = Math.min(min, q.chaosValue());
            max = Math.max(max, q.chaosValue());
        }
        if (min <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return (max - min) / min;
    }

    private Quote selectPrimary(List<Quote> quotes) {
        if (primarySourceId != null) {
            for (Quote q : quotes) {
                if (primarySourceId.equals(q.sourceId())) {
                    return q;
                }
            }
        }
        return quotes.get(0);
    }
}

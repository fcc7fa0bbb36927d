package com.pricecheck.common.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Robust summary of a set of historical quote values.
 *
 * <ul>
 *   <li>{@code p25}/{@code p75}: linear interpolation between closest ranks</li>
 *   <li>{@code trimmedMean}    : mean of the middle 50% when at least 4 values, else the mean</li>
 *   <li>{@code stddev}         : population standard deviation; 0 below 2 values</li>
 * </ul>
 *
 * <p>All fields other than {@code count} are {@code null} for an empty input.
 */
public record PriceStatistics(
    @JsonProperty("count")       int count,
    @JsonProperty("min")         Double min,
    @JsonProperty("max")         Double max,
    @JsonProperty("mean")        Double mean,
    @JsonProperty("median")      Double median,
    @JsonProperty("p25")         Double p25,
    @JsonProperty("p75")         Double p75,
    @JsonProperty("trimmedMean") Double trimmedMean,
    @JsonProperty("stddev")      Double stddev
) {
    private static final int TRIM_MIN_COUNT = 4;

    public static PriceStatistics empty() {
        return new PriceStatistics(0, null, null, null, null, null, null, null, null);
    }

    public static PriceStatistics of(List<Double> values) {
        List<Double> prices = new ArrayList<>();
        if (values != null) {
            for (Double v : values) {
                if (v != null && !v.isNaN()) {
                    prices.add(v);
                }
            }
        }
        if (prices.isEmpty()) {
            return empty();
        }
        Collections.sort(prices);

        int count = prices.size();
        double sum = 0.0;
        for (double p : prices) {
            sum += p;
        }
        double mean = sum / count;

        double trimmedMean = mean;
        if (count >= TRIM_MIN_COUNT) {
            int start = (int) (count * 0.25);
            int end   = Math.max(start + 1, (int) (count * 0.75));
            double trimmedSum = 0.0;
            for (int i = start; i < end; i++) {
                trimmedSum += prices.get(i);
            }
            trimmedMean = trimmedSum / (end - start);
        }

        double stddev = 0.0;
        if (count >= 2) {
            double variance = 0.0;
            for (double p : prices) {
                variance += (p - mean) * (p - mean);
            }
            stddev = Math.sqrt(variance / count);
        }

        return new PriceStatistics(
            count,
            prices.get(0),
            prices.get(count - 1),
            mean,
            percentile(prices, 0.5),
            percentile(prices, 0.25),
            percentile(prices, 0.75),
            trimmedMean,
            stddev);
    }

    static double percentile(List<Double> sorted, double q) {
        double idx  = (sorted.size() - 1) * q;
        int lo      = (int) idx;
        int hi      = Math.min(lo + 1, sorted.size() - 1);
        double frac = idx - lo;
        return sorted.get(lo) * (1 - frac) + sorted.get(hi) * frac;
    }
}

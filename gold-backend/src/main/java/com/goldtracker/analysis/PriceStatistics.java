package com.goldtracker.analysis;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Descriptive statistics over a chronological price array (oldest first).
 * An empty array is an error everywhere; "too few points" is an empty result.
 */
public final class PriceStatistics {

    private PriceStatistics() {
    }

    public static double pctChange(double current, double previous) {
        if (previous == 0) {
            throw new IllegalArgumentException("Previous price is zero");
        }
        return (current - previous) / previous * 100;
    }

    /**
     * Population standard deviation of day-over-day percent changes.
     */
    public static OptionalDouble volatility(double[] prices) {
        requireData(prices);
        if (prices.length < 2) {
            return OptionalDouble.empty();
        }
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = pctChange(prices[i], prices[i - 1]);
        }
        double mean = Arrays.stream(returns).average().orElseThrow();
        double variance = Arrays.stream(returns).map(r -> (r - mean) * (r - mean)).sum() / returns.length;
        return OptionalDouble.of(Math.sqrt(variance));
    }

    /**
     * Mean of the trailing {@code period} points; empty when fewer exist.
     */
    public static OptionalDouble movingAverage(double[] prices, int period) {
        requireData(prices);
        if (period <= 0) {
            throw new IllegalArgumentException("period must be positive, got " + period);
        }
        if (prices.length < period) {
            return OptionalDouble.empty();
        }
        return Arrays.stream(prices, prices.length - period, prices.length).average();
    }

    /**
     * Rank of the last price within the sorted distribution, 0 to 100. The rank is the
     * index of the first sorted value at or above the current price, so ties share the lower rank.
     */
    public static OptionalDouble percentileRank(double[] prices) {
        requireData(prices);
        if (prices.length < 2) {
            return OptionalDouble.empty();
        }
        double current = prices[prices.length - 1];
        double[] sorted = prices.clone();
        Arrays.sort(sorted);
        int index = 0;
        while (sorted[index] < current) {
            index++;
        }
        return OptionalDouble.of(index * 100.0 / (sorted.length - 1));
    }

    /**
     * Percent change from the point {@code days} back; empty without enough history.
     */
    public static OptionalDouble changeOver(double[] prices, int days) {
        requireData(prices);
        if (prices.length < days + 1) {
            return OptionalDouble.empty();
        }
        double previous = prices[prices.length - 1 - days];
        return OptionalDouble.of(pctChange(prices[prices.length - 1], previous));
    }

    /**
     * Annualized volatility of daily log returns, in percent (252 trading days).
     */
    public static OptionalDouble annualizedLogVolatility(double[] prices) {
        requireData(prices);
        if (prices.length < 2) {
            return OptionalDouble.empty();
        }
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = Math.log(prices[i] / prices[i - 1]);
        }
        double mean = Arrays.stream(returns).average().orElseThrow();
        double variance = Arrays.stream(returns).map(r -> (r - mean) * (r - mean)).sum() / returns.length;
        return OptionalDouble.of(Math.sqrt(variance) * Math.sqrt(252) * 100);
    }

    private static void requireData(double[] prices) {
        if (prices == null || prices.length == 0) {
            throw new IllegalArgumentException("Price series is empty");
        }
    }
}

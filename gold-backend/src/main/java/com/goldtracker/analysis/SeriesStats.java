package com.goldtracker.analysis;

import com.goldtracker.api.model.HistoricalPoint;
import com.goldtracker.api.model.HistoricalSeries;

import java.time.LocalDate;

/**
 * USD per ounce summary of a long history window.
 */
public record SeriesStats(
    double min,
    double max,
    double avg,
    double current,
    double first,
    LocalDate minDate,
    LocalDate maxDate,
    double totalChange,
    double annualizedVolatility,
    int dataPoints
) {

    /**
     * @throws IllegalArgumentException if the series is empty
     */
    public static SeriesStats of(HistoricalSeries series) {
        if (series.isEmpty()) {
            throw new IllegalArgumentException("Cannot summarize an empty series");
        }
        double[] prices = series.values(HistoricalPoint::usdPerOunce);

        int minIdx = 0;
        int maxIdx = 0;
        double sum = 0;
        for (int i = 0; i < prices.length; i++) {
            if (prices[i] < prices[minIdx]) minIdx = i;
            if (prices[i] > prices[maxIdx]) maxIdx = i;
            sum += prices[i];
        }

        double first = prices[0];
        double current = prices[prices.length - 1];
        return new SeriesStats(
            prices[minIdx],
            prices[maxIdx],
            sum / prices.length,
            current,
            first,
            series.get(minIdx).date(),
            series.get(maxIdx).date(),
            first > 0 ? PriceStatistics.pctChange(current, first) : 0,
            PriceStatistics.annualizedLogVolatility(prices).orElse(0),
            prices.length);
    }
}

package com.goldtracker.analysis;

import com.goldtracker.api.model.HistoricalPoint;
import com.goldtracker.api.model.HistoricalSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Price Statistics Tests")
class PriceStatisticsTest {

    @Nested
    @DisplayName("Volatility")
    class Volatility {

        @Test
        @DisplayName("Population std of percent changes")
        void populationStd() {
            assertThat(PriceStatistics.volatility(new double[]{100, 110, 99}).getAsDouble())
                .isCloseTo(10.0, within(1e-9));
        }

        @Test
        @DisplayName("Constant prices have zero volatility")
        void constant() {
            assertThat(PriceStatistics.volatility(new double[]{50, 50, 50}).getAsDouble()).isZero();
        }

        @Test
        @DisplayName("A single point has no volatility")
        void singlePoint() {
            assertThat(PriceStatistics.volatility(new double[]{100})).isEmpty();
        }
    }

    @Test
    @DisplayName("Moving average covers the trailing window")
    void movingAverage() {
        double[] prices = {1, 2, 3, 4, 5};

        assertThat(PriceStatistics.movingAverage(prices, 3).getAsDouble()).isEqualTo(4.0);
        assertThat(PriceStatistics.movingAverage(prices, 5).getAsDouble()).isEqualTo(3.0);
        assertThat(PriceStatistics.movingAverage(prices, 6)).isEmpty();
        assertThatThrownBy(() -> PriceStatistics.movingAverage(prices, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Percentile rank of the latest price counts only strictly lower values, so ties take the lower rank")
    void percentileRank() {
        assertThat(PriceStatistics.percentileRank(new double[]{1, 2, 3, 4, 5}).getAsDouble()).isEqualTo(100.0);
        assertThat(PriceStatistics.percentileRank(new double[]{5, 4, 3, 2, 1}).getAsDouble()).isZero();
        assertThat(PriceStatistics.percentileRank(new double[]{1, 3, 3, 2, 3}).getAsDouble()).isEqualTo(50.0);
        assertThat(PriceStatistics.percentileRank(new double[]{7})).isEmpty();
    }

    @Test
    @DisplayName("Change over a lookback needs one extra point")
    void changeOver() {
        double[] prices = {100, 101, 102, 103, 104, 105, 106, 110};

        assertThat(PriceStatistics.changeOver(prices, 7).getAsDouble()).isCloseTo(10.0, within(1e-9));
        assertThat(PriceStatistics.changeOver(prices, 8)).isEmpty();
    }

    @Test
    @DisplayName("Empty input is an error")
    void emptyInput() {
        double[] empty = {};

        assertThatThrownBy(() -> PriceStatistics.volatility(empty)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PriceStatistics.movingAverage(empty, 7)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PriceStatistics.percentileRank(empty)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PriceStatistics.changeOver(empty, 7)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Zero previous price cannot give a percent change")
    void zeroPrevious() {
        assertThatThrownBy(() -> PriceStatistics.pctChange(10, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Series summary")
    class Summary {

        @Test
        @DisplayName("Min, max and change over the window")
        void summary() {
            var day = LocalDate.of(2020, 3, 2);
            var series = new HistoricalSeries(List.of(
                new HistoricalPoint(day, 1600, 1),
                new HistoricalPoint(day.plusDays(1), 1450, 1),
                new HistoricalPoint(day.plusDays(2), 1900, 1),
                new HistoricalPoint(day.plusDays(3), 2000, 1)));

            var stats = SeriesStats.of(series);

            assertThat(stats.min()).isEqualTo(1450.0);
            assertThat(stats.minDate()).isEqualTo(day.plusDays(1));
            assertThat(stats.max()).isEqualTo(2000.0);
            assertThat(stats.maxDate()).isEqualTo(day.plusDays(3));
            assertThat(stats.avg()).isEqualTo(1737.5);
            assertThat(stats.totalChange()).isCloseTo(25.0, within(1e-9));
            assertThat(stats.annualizedVolatility()).isPositive();
            assertThat(stats.dataPoints()).isEqualTo(4);
        }

        @Test
        @DisplayName("Empty series is rejected")
        void empty() {
            assertThatThrownBy(() -> SeriesStats.of(new HistoricalSeries(List.of())))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}

package com.goldtracker.analysis;

import java.util.List;

/**
 * Aggregates over a set of drawdowns. Recovery figures cover recovered events only;
 * {@code longestRecoveryDays} is null when nothing recovered.
 */
public record DrawdownSummary(
    int totalDrawdowns,
    int recovered,
    int notRecovered,
    double worstDrawdownPct,
    Long longestRecoveryDays,
    long avgRecoveryDays
) {

    public static DrawdownSummary of(List<Drawdown> drawdowns) {
        var recoveryDays = drawdowns.stream()
            .filter(Drawdown::recovered)
            .mapToLong(Drawdown::daysToRecovery)
            .summaryStatistics();

        double worst = drawdowns.stream().mapToDouble(Drawdown::drawdownPct).max().orElse(0);
        int recovered = (int) recoveryDays.getCount();

        return new DrawdownSummary(
            drawdowns.size(),
            recovered,
            drawdowns.size() - recovered,
            worst,
            recovered > 0 ? recoveryDays.getMax() : null,
            recovered > 0 ? Math.round(recoveryDays.getAverage()) : 0);
    }
}

package com.goldtracker.analysis;

import com.goldtracker.api.model.HistoricalPoint;
import com.goldtracker.api.model.HistoricalSeries;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Forward scan for peak, trough and recovery cycles.
 *
 * A point is a candidate peak when no point in the following lookahead window is
 * higher. The window is at most {@value #LOOKAHEAD} points and ends early at the
 * first point back at the candidate's level. From a peak the running minimum is the
 * trough; the first later point at or above the peak is the recovery. Scanning
 * resumes after the recovery (or the trough) of an emitted drawdown, so windows never overlap.
 * <p>
 * Without the early stop, index 0 of {@code [100, 80, 70, 90, 100, 105]} would not be a peak
 * because 105 falls inside its window, and the 30% cycle back to 100 would be missed.
 */
public final class DrawdownDetector {
    static final int LOOKAHEAD = 20;

    private DrawdownDetector() {
    }

    public static List<Drawdown> detect(HistoricalSeries series, double minDrawdownPct) {
        return detect(series, minDrawdownPct, HistoricalPoint::usdPerOunce);
    }

    public static List<Drawdown> detect(HistoricalSeries series, double minDrawdownPct,
                                        ToDoubleFunction<HistoricalPoint> price) {
        if (!(minDrawdownPct > 0)) {
            throw new IllegalArgumentException("minDrawdownPct must be > 0, got " + minDrawdownPct);
        }
        double[] prices = series.values(price);
        var drawdowns = new ArrayList<Drawdown>();
        int n = prices.length;
        int i = 0;

        while (i < n - 1) {
            if (!isPeak(prices, i)) {
                i++;
                continue;
            }

            int troughIdx = i;
            int recoveryIdx = -1;
            for (int j = i + 1; j < n; j++) {
                if (prices[j] < prices[troughIdx]) {
                    troughIdx = j;
                }
                if (j > troughIdx && prices[j] >= prices[i]) {
                    recoveryIdx = j;
                    break;
                }
            }

            double pct = (prices[i] - prices[troughIdx]) * 100 / prices[i];
            if (pct >= minDrawdownPct) {
                drawdowns.add(toDrawdown(series, prices, i, troughIdx, recoveryIdx, pct));
                i = recoveryIdx >= 0 ? recoveryIdx : troughIdx;
            }
            i++;
        }
        return drawdowns;
    }

    static boolean isPeak(double[] prices, int i) {
        int end = Math.min(i + LOOKAHEAD, prices.length - 1);
        for (int j = i + 1; j <= end; j++) {
            if (prices[j] > prices[i]) {
                return false;
            }
            if (prices[j] == prices[i]) {
                return true;
            }
        }
        return true;
    }

    private static Drawdown toDrawdown(HistoricalSeries series, double[] prices,
                                       int peakIdx, int troughIdx, int recoveryIdx, double pct) {
        var peakDate = series.get(peakIdx).date();
        var troughDate = series.get(troughIdx).date();
        var recoveryDate = recoveryIdx >= 0 ? series.get(recoveryIdx).date() : null;
        return new Drawdown(
            peakDate, prices[peakIdx],
            troughDate, prices[troughIdx],
            pct,
            recoveryDate,
            ChronoUnit.DAYS.between(peakDate, troughDate),
            recoveryDate != null ? ChronoUnit.DAYS.between(peakDate, recoveryDate) : null,
            recoveryDate != null);
    }
}

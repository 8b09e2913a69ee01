package com.goldtracker.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Decision inputs derived from the persisted artifacts ({@code signals.json}).
 * A missing value means the signal could not be computed; it is never zero-filled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MarketSignals(
    Instant latestTimestamp,
    Double sjcVndPerTael,
    Double intlVndPerTael,
    Double premiumPct,
    Double change7dPct,
    Double change30dPct,
    Double volatilityDailyPct,
    Double ma7VndPerTael,
    Double ma30VndPerTael,
    Double percentile5y,
    DrawdownDigest drawdowns
) {

    public static final String FILE_NAME = "signals.json";

    public record DrawdownDigest(int total, int recovered, int notRecovered,
                                 double worstPct, long avgRecoveryDays) {

        static DrawdownDigest of(DrawdownSummary summary) {
            return new DrawdownDigest(summary.totalDrawdowns(), summary.recovered(), summary.notRecovered(),
                SignalService.round(summary.worstDrawdownPct(), 2), summary.avgRecoveryDays());
        }
    }
}

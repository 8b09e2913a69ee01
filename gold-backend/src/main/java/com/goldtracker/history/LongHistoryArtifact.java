package com.goldtracker.history;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.goldtracker.analysis.SeriesStats;
import com.goldtracker.api.model.HistoricalSeries;

import java.time.Instant;

/**
 * Multi-year international history with its summary ({@code history-<years>y.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LongHistoryArtifact(
    Instant fetchedAt,
    int years,
    double exchangeRate,
    SeriesStats stats,
    HistoricalSeries data
) {

    public static String fileName(int years) {
        return "history-" + years + "y.json";
    }
}

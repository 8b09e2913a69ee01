package com.goldtracker.history;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.goldtracker.api.model.HistoricalSeries;

import java.time.Instant;

/**
 * Recent international history ({@code history.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoryArtifact(
    Instant fetchedAt,
    int days,
    ExchangeRate exchangeRate,
    HistoricalSeries data
) {

    public static final String FILE_NAME = "history.json";
    public static final String CSV_FILE_NAME = "history.csv";

    /**
     * The USD/VND rate the series was converted at; {@code live} is false when the
     * configured historical rate stood in for a failed lookup.
     */
    public record ExchangeRate(double usdVnd, Instant fetchedAt, boolean live) {}
}

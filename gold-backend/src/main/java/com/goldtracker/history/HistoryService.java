package com.goldtracker.history;

import com.goldtracker.acquisition.AcquisitionException;
import com.goldtracker.analysis.SeriesStats;
import com.goldtracker.api.FallbackChain;
import com.goldtracker.api.HistorySource;
import com.goldtracker.api.model.ExchangeRateTable;
import com.goldtracker.api.model.HistoricalPoint;
import com.goldtracker.api.model.HistoricalSeries;
import com.goldtracker.api.model.UsdPricePoint;
import com.goldtracker.api.sources.ExchangeRateProvider;
import com.goldtracker.config.Config;
import com.goldtracker.persistence.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * International price history converted to canonical VND units.
 */
public final class HistoryService {
    private static final Logger logger = LoggerFactory.getLogger(HistoryService.class);

    public static final int MIN_YEARS = 1;
    public static final int MAX_YEARS = 19;
    static final int MAX_POINTS = 5000;

    private final List<HistorySource> recentSources;
    private final List<HistorySource> longSources;
    private final ExchangeRateProvider rates;
    private final Config config;

    public HistoryService(List<HistorySource> recentSources, List<HistorySource> longSources,
                          ExchangeRateProvider rates, Config config) {
        this.recentSources = List.copyOf(recentSources);
        this.longSources = List.copyOf(longSources);
        this.rates = rates;
        this.config = config;
    }

    public HistoryArtifact fetchHistory(int days) throws AcquisitionException {
        if (days < 1) {
            throw new IllegalArgumentException("days must be at least 1, got " + days);
        }
        var rate = usdVndRate();
        var series = fetchSeries(recentSources, days, rate.usdVnd());
        logger.info("History: {} point(s) over {} day(s) at {} VND/USD", series.size(), days, rate.usdVnd());
        return new HistoryArtifact(Instant.now(), days, rate, series);
    }

    public LongHistoryArtifact fetchLongHistory(int years) throws AcquisitionException {
        if (years < MIN_YEARS || years > MAX_YEARS) {
            throw new IllegalArgumentException("years must be between " + MIN_YEARS + " and " + MAX_YEARS + ", got " + years);
        }
        int days = Math.min(years * 365, MAX_POINTS);
        var rate = usdVndRate();
        var series = fetchSeries(longSources, days, rate.usdVnd());
        var stats = SeriesStats.of(series);
        logger.info("Long history ({}y): {} point(s), {}% change, {}% annualized volatility",
            years, stats.dataPoints(), String.format("%.2f", stats.totalChange()),
            String.format("%.1f", stats.annualizedVolatility()));
        return new LongHistoryArtifact(Instant.now(), years, rate.usdVnd(), stats, series);
    }

    public void save(HistoryArtifact artifact, ArtifactStore store) throws IOException {
        store.writeJson(HistoryArtifact.FILE_NAME, artifact);
        store.writeText(HistoryArtifact.CSV_FILE_NAME, toCsv(artifact.data()));
    }

    public void save(LongHistoryArtifact artifact, ArtifactStore store) throws IOException {
        store.writeJson(LongHistoryArtifact.fileName(artifact.years()), artifact);
    }

    static String toCsv(HistoricalSeries series) {
        var csv = new StringBuilder("date,usd_per_oz,usd_per_gram,vnd_per_gram,vnd_per_tael");
        for (HistoricalPoint p : series.points()) {
            csv.append('\n').append(String.format(Locale.ROOT, "%s,%.2f,%.2f,%.0f,%.0f",
                p.date(), p.usdPerOunce(), p.usdPerGram(), p.vndPerGram(), p.vndPerTael()));
        }
        return csv.toString();
    }

    private HistoricalSeries fetchSeries(List<HistorySource> sources, int days, double usdVnd)
            throws AcquisitionException {
        var result = FallbackChain.fetchHistory(sources, days);
        if (!result.isSuccess()) {
            throw new AcquisitionException("International history unavailable: " + result.error());
        }
        List<UsdPricePoint> points = result.data();
        if (points.isEmpty()) {
            throw new AcquisitionException("International history unavailable: no data points");
        }
        return HistoricalSeries.of(points.stream().map(p -> HistoricalPoint.fromUsd(p, usdVnd)).toList());
    }

    private HistoryArtifact.ExchangeRate usdVndRate() {
        var result = rates.fetchRates();
        if (result.isSuccess()) {
            var vnd = result.data().rate(ExchangeRateTable.VND);
            if (vnd.isPresent()) {
                return new HistoryArtifact.ExchangeRate(vnd.getAsDouble(), Instant.now(), true);
            }
        }
        logger.warn("Live USD/VND rate unavailable ({}); using configured {}",
            result.isSuccess() ? "no VND rate" : result.error(), config.historicalExchangeRate());
        return new HistoryArtifact.ExchangeRate(config.historicalExchangeRate(), Instant.now(), false);
    }
}

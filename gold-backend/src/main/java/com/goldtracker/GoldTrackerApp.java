package com.goldtracker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.goldtracker.acquisition.AcquisitionException;
import com.goldtracker.acquisition.AcquisitionOrchestrator;
import com.goldtracker.analysis.DrawdownReport;
import com.goldtracker.analysis.MarketSignals;
import com.goldtracker.analysis.SignalService;
import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.model.HistoricalSeries;
import com.goldtracker.api.sources.MarketSources;
import com.goldtracker.config.Config;
import com.goldtracker.history.DailySnapshotCollector;
import com.goldtracker.history.HistoryService;
import com.goldtracker.history.LongHistoryArtifact;
import com.goldtracker.metrics.MetricsService;
import com.goldtracker.persistence.ArtifactStore;
import com.goldtracker.pricing.NormalizationEngine;
import com.goldtracker.pricing.QuoteSnapshot;
import com.goldtracker.pricing.QuoteSnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command-line entry point. One command per invocation:
 *
 *   fetch                      quote snapshot of every market (default)
 *   history [days]             recent international history, default 30 days
 *   long-history [years]       1-19 years of history with summary statistics
 *   collect-daily              append today's Vietnam snapshot to the daily log
 *   drawdowns [minPct] [file]  drawdown analysis of a saved history file
 *   signals                    market signals from the saved artifacts
 *
 * Exit code 0 on success (warnings allowed), 1 on a hard failure or invalid input.
 */
public final class GoldTrackerApp {
    private static final Logger logger = LoggerFactory.getLogger(GoldTrackerApp.class);

    private final Config config;
    private final MetricsService metrics;
    private final MarketSources sources;
    private final ArtifactStore store;

    GoldTrackerApp(Config config, MetricsService metrics, MarketSources sources, ArtifactStore store) {
        this.config = config;
        this.metrics = metrics;
        this.sources = sources;
        this.store = store;
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        String command = args.length > 0 ? args[0] : "fetch";
        try {
            var config = new Config();
            var metrics = MetricsService.prometheus();
            var fetcher = new HttpFetcher(config.httpTimeout());
            var app = new GoldTrackerApp(config, metrics, new MarketSources(config, fetcher, metrics),
                new ArtifactStore(config.dataDir()));

            app.execute(command, args);
            logger.debug("Metrics:\n{}", metrics.scrape());
            return 0;
        } catch (AcquisitionException e) {
            logger.error("❌ {} failed: {}", command, e.getMessage());
        } catch (IOException e) {
            logger.error("❌ {} failed: could not read or write artifacts", command, e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error("❌ {} failed: {}", command, e.getMessage());
        }
        return 1;
    }

    void execute(String command, String[] args) throws AcquisitionException, IOException {
        switch (command) {
            case "fetch" -> fetch();
            case "history" -> history(intArg(args, 1, 30));
            case "long-history" -> longHistory(intArg(args, 1, 1));
            case "collect-daily" -> collectDaily();
            case "drawdowns" -> drawdowns(
                doubleArg(args, 1, config.drawdownThresholdPct()),
                args.length > 2 ? Path.of(args[2]) : store.resolve(LongHistoryArtifact.fileName(HistoryService.MAX_YEARS)));
            case "signals" -> signals();
            default -> throw new IllegalArgumentException("Unknown command: " + command
                + " (expected fetch, history, long-history, collect-daily, drawdowns, signals)");
        }
    }

    private void fetch() throws AcquisitionException, IOException {
        var orchestrator = new AcquisitionOrchestrator(sources, metrics, config.marketTimeout(), config.fetchThreads());
        var snapshot = new QuoteSnapshotService(orchestrator, new NormalizationEngine()).buildSnapshot();
        store.writeJson(QuoteSnapshot.FILE_NAME, snapshot);

        snapshot.normalized().forEach(q -> logger.info("  {} [{}]: {} VND/tael",
            q.source(), q.country(), String.format("%,.0f", q.vndPerTael())));
        if (!snapshot.warnings().isEmpty()) {
            logger.warn("⚠️ {} warning(s): {}", snapshot.warnings().size(), String.join("; ", snapshot.warnings()));
        }
    }

    private void history(int days) throws AcquisitionException, IOException {
        var service = historyService();
        service.save(service.fetchHistory(days), store);
    }

    private void longHistory(int years) throws AcquisitionException, IOException {
        var service = historyService();
        service.save(service.fetchLongHistory(years), store);
    }

    private void collectDaily() throws AcquisitionException, IOException {
        new DailySnapshotCollector(sources.vietnam(), sources.benchmark(), config, store).collect();
    }

    private void drawdowns(double minPct, Path file) throws IOException {
        var series = store.readJson(file, SeriesFile.class).data();
        if (series == null || series.isEmpty()) {
            throw new IllegalStateException(file + " has no data points");
        }
        logger.info("Analyzing {} points ({} to {}), threshold {}%",
            series.size(), series.first().date(), series.last().date(), minPct);

        var report = DrawdownReport.analyze(series, minPct, file.toString());
        store.writeJson(DrawdownReport.FILE_NAME, report);

        var summary = report.summary();
        logger.info("{} drawdown(s) >= {}%: {} recovered, {} not recovered, worst {}%",
            summary.totalDrawdowns(), minPct, summary.recovered(), summary.notRecovered(),
            String.format("%.1f", summary.worstDrawdownPct()));
    }

    private void signals() throws IOException {
        MarketSignals signals = new SignalService(store).generate();
        store.writeJson(MarketSignals.FILE_NAME, signals);
    }

    private HistoryService historyService() {
        return new HistoryService(sources.history(), sources.longHistory(), sources.exchangeRates(), config);
    }

    static int intArg(String[] args, int index, int defaultValue) {
        if (args.length <= index) return defaultValue;
        try {
            return Integer.parseInt(args[index].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + args[index]);
        }
    }

    static double doubleArg(String[] args, int index, double defaultValue) {
        if (args.length <= index) return defaultValue;
        try {
            return Double.parseDouble(args[index].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + args[index]);
        }
    }

    /**
     * Any saved history artifact; only its series is read.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SeriesFile(HistoricalSeries data) {}
}

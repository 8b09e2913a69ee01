package com.goldtracker;

import com.goldtracker.analysis.DrawdownReport;
import com.goldtracker.analysis.SeriesStats;
import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.model.HistoricalPoint;
import com.goldtracker.api.model.HistoricalSeries;
import com.goldtracker.api.sources.MarketSources;
import com.goldtracker.config.Config;
import com.goldtracker.history.LongHistoryArtifact;
import com.goldtracker.metrics.MetricsService;
import com.goldtracker.persistence.ArtifactStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Gold Tracker App Tests")
class GoldTrackerAppTest {

    @TempDir
    Path dataDir;

    private GoldTrackerApp app;
    private ArtifactStore store;

    @BeforeEach
    void setUp() {
        var config = new Config(new Properties(), Map.of("DATA_DIR", dataDir.toString()));
        var metrics = new MetricsService(new SimpleMeterRegistry());
        store = new ArtifactStore(dataDir);
        app = new GoldTrackerApp(config, metrics,
            new MarketSources(config, new HttpFetcher(config.httpTimeout()), metrics), store);
    }

    @Nested
    @DisplayName("Arguments")
    class Arguments {

        @Test
        @DisplayName("Numeric arguments fall back to defaults")
        void defaults() {
            assertThat(GoldTrackerApp.intArg(new String[]{"history"}, 1, 30)).isEqualTo(30);
            assertThat(GoldTrackerApp.intArg(new String[]{"history", "90"}, 1, 30)).isEqualTo(90);
            assertThat(GoldTrackerApp.doubleArg(new String[]{"drawdowns", "12.5"}, 1, 10)).isEqualTo(12.5);
        }

        @Test
        @DisplayName("Malformed numbers are rejected")
        void malformed() {
            assertThatThrownBy(() -> GoldTrackerApp.intArg(new String[]{"history", "month"}, 1, 30))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Not an integer: month");
            assertThatThrownBy(() -> GoldTrackerApp.doubleArg(new String[]{"drawdowns", "x"}, 1, 10))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Unknown command is rejected")
        void unknownCommand() {
            assertThatThrownBy(() -> app.execute("trade", new String[]{"trade"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Unknown command: trade");
        }

        @Test
        @DisplayName("Unknown command exits with status 1")
        void exitStatus() {
            assertThat(GoldTrackerApp.run(new String[]{"trade"})).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Drawdown command analyzes the saved long history")
    void drawdownsCommand() throws Exception {
        var points = new ArrayList<HistoricalPoint>();
        double[] prices = {100, 80, 70, 90, 100, 105};
        for (int i = 0; i < prices.length; i++) {
            points.add(new HistoricalPoint(LocalDate.of(2006, 1, 2).plusDays(i), prices[i], prices[i] * 800));
        }
        var series = new HistoricalSeries(points);
        store.writeJson(LongHistoryArtifact.fileName(19),
            new LongHistoryArtifact(Instant.now(), 19, 25_000, SeriesStats.of(series), series));

        app.execute("drawdowns", new String[]{"drawdowns"});

        var report = store.readJson(DrawdownReport.FILE_NAME, DrawdownReport.class);
        assertThat(report.minDrawdownPct()).isEqualTo(10.0);
        assertThat(report.summary().totalDrawdowns()).isEqualTo(1);
        assertThat(report.drawdowns().get(0).recovered()).isTrue();
        assertThat(report.dataFile()).endsWith("history-19y.json");
    }

    @Test
    @DisplayName("Signals without a snapshot fail")
    void signalsWithoutSnapshot() {
        assertThatThrownBy(() -> app.execute("signals", new String[]{"signals"}))
            .isInstanceOf(NoSuchFileException.class);
    }
}

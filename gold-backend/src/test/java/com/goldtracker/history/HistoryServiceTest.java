package com.goldtracker.history;

import com.goldtracker.acquisition.AcquisitionException;
import com.goldtracker.api.FetchResult;
import com.goldtracker.api.HistorySource;
import com.goldtracker.api.model.ExchangeRateTable;
import com.goldtracker.api.model.HistoricalPoint;
import com.goldtracker.api.model.HistoricalSeries;
import com.goldtracker.api.model.UsdPricePoint;
import com.goldtracker.api.sources.ExchangeRateProvider;
import com.goldtracker.config.Config;
import com.goldtracker.persistence.ArtifactStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.IntFunction;

import static org.assertj.core.api.Assertions.*;

@DisplayName("History Service Tests")
class HistoryServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 2);
    private static final Config CONFIG = new Config(new Properties(), Map.of("HISTORICAL_EXCHANGE_RATE", "25500"));

    private static HistorySource source(String name, IntFunction<FetchResult<List<UsdPricePoint>>> call) {
        return new HistorySource() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public FetchResult<List<UsdPricePoint>> fetchHistory(int days) {
                return call.apply(days);
            }
        };
    }

    private static FetchResult<List<UsdPricePoint>> points(int days) {
        var points = new ArrayList<UsdPricePoint>();
        for (int i = 0; i < Math.min(days, 10); i++) {
            points.add(new UsdPricePoint(START.plusDays(i), 2000 + i));
        }
        return FetchResult.success(points);
    }

    private static ExchangeRateProvider rates(FetchResult<ExchangeRateTable> result) {
        return new ExchangeRateProvider() {
            @Override
            public String name() {
                return "fx";
            }

            @Override
            public FetchResult<ExchangeRateTable> fetchRates() {
                return result;
            }
        };
    }

    private static final ExchangeRateProvider LIVE =
        rates(FetchResult.success(new ExchangeRateTable(Map.of("VND", 25_000.0))));

    @Nested
    @DisplayName("Exchange rate")
    class ExchangeRate {

        @Test
        @DisplayName("Live rate is used when available")
        void liveRate() throws Exception {
            var service = new HistoryService(List.of(source("a", HistoryServiceTest::points)), List.of(), LIVE, CONFIG);

            var artifact = service.fetchHistory(30);

            assertThat(artifact.exchangeRate().usdVnd()).isEqualTo(25_000.0);
            assertThat(artifact.exchangeRate().live()).isTrue();
            assertThat(artifact.data().first().vndPerGram()).isCloseTo(2000 / 31.1035 * 25_000, within(1e-6));
        }

        @Test
        @DisplayName("Configured rate stands in for a failed lookup")
        void fallbackRate() throws Exception {
            var service = new HistoryService(List.of(source("a", HistoryServiceTest::points)), List.of(),
                rates(FetchResult.failure("HTTP 500")), CONFIG);

            var artifact = service.fetchHistory(30);

            assertThat(artifact.exchangeRate().usdVnd()).isEqualTo(25_500.0);
            assertThat(artifact.exchangeRate().live()).isFalse();
        }
    }

    @Test
    @DisplayName("Falls back to the next history source")
    void fallsBack() throws Exception {
        var service = new HistoryService(List.of(
            source("down", days -> FetchResult.failure("HTTP 503")),
            source("up", HistoryServiceTest::points)), List.of(), LIVE, CONFIG);

        assertThat(service.fetchHistory(5).data().size()).isEqualTo(5);
    }

    @Test
    @DisplayName("All history sources failing is an error")
    void allFail() {
        var service = new HistoryService(List.of(source("down", days -> FetchResult.failure("HTTP 503"))),
            List.of(), LIVE, CONFIG);

        assertThatThrownBy(() -> service.fetchHistory(30))
            .isInstanceOf(AcquisitionException.class)
            .hasMessage("International history unavailable: HTTP 503");
    }

    @Nested
    @DisplayName("Long history")
    class LongHistory {

        @Test
        @DisplayName("Requests at most 5000 days")
        void capsDays() throws Exception {
            var requested = new ArrayList<Integer>();
            var service = new HistoryService(List.of(), List.of(source("long", days -> {
                requested.add(days);
                return points(days);
            })), LIVE, CONFIG);

            var artifact = service.fetchLongHistory(19);

            assertThat(requested).containsExactly(5000);
            assertThat(artifact.years()).isEqualTo(19);
            assertThat(artifact.stats().dataPoints()).isEqualTo(10);
        }

        @Test
        @DisplayName("Years outside 1 to 19 are rejected")
        void yearBounds() {
            var service = new HistoryService(List.of(), List.of(source("long", HistoryServiceTest::points)), LIVE, CONFIG);

            assertThatThrownBy(() -> service.fetchLongHistory(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.fetchLongHistory(20)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("CSV rows carry rounded canonical units")
    void csv() {
        var series = new HistoricalSeries(List.of(
            HistoricalPoint.fromUsd(new UsdPricePoint(START, 2000), 25_000)));

        assertThat(HistoryService.toCsv(series)).isEqualTo(
            "date,usd_per_oz,usd_per_gram,vnd_per_gram,vnd_per_tael\n"
                + "2024-01-02,2000.00,64.30,1607536,60282605");
    }

    @Test
    @DisplayName("Saving writes JSON and CSV")
    void save(@TempDir Path dataDir) throws Exception {
        var store = new ArtifactStore(dataDir);
        var service = new HistoryService(List.of(source("a", HistoryServiceTest::points)), List.of(), LIVE, CONFIG);

        service.save(service.fetchHistory(3), store);

        assertThat(store.readJson(HistoryArtifact.FILE_NAME, HistoryArtifact.class).data().size()).isEqualTo(3);
        assertThat(Files.readAllLines(dataDir.resolve(HistoryArtifact.CSV_FILE_NAME))).hasSize(4);
    }
}

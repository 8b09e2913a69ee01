package com.goldtracker.history;

import com.goldtracker.acquisition.AcquisitionException;
import com.goldtracker.api.FetchResult;
import com.goldtracker.api.PriceSource;
import com.goldtracker.api.model.RawQuote;
import com.goldtracker.config.Config;
import com.goldtracker.persistence.ArtifactStore;
import com.goldtracker.pricing.PremiumCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Daily Snapshot Collector Tests")
class DailySnapshotCollectorTest {

    // 20:00 UTC on May 1 is already May 2 in Vietnam
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T20:00:00Z"), ZoneOffset.UTC);
    private static final Config CONFIG = new Config(new Properties(), Map.of("HISTORICAL_EXCHANGE_RATE", "25000"));

    @TempDir
    Path dataDir;

    private ArtifactStore store;
    private PriceSource vietnam;
    private PriceSource benchmark;

    @BeforeEach
    void setUp() {
        store = new ArtifactStore(dataDir);
        vietnam = mock(PriceSource.class);
        benchmark = mock(PriceSource.class);
        when(vietnam.name()).thenReturn("Vietnam");
        when(benchmark.name()).thenReturn("International");
        when(benchmark.fetch()).thenReturn(FetchResult.success(List.of(
            RawQuote.perOunce("FreeGoldAPI", "International", "USD", 2000, CLOCK.instant()))));
        when(vietnam.fetch()).thenReturn(FetchResult.success(List.of(
            RawQuote.buySell("SJC Miếng", "Vietnam", "VND", 80e6, 82e6, CLOCK.instant()),
            RawQuote.buySell("SJC Nhẫn", "Vietnam", "VND", 78e6, 80e6, CLOCK.instant()))));
    }

    private DailySnapshotCollector collector() {
        return new DailySnapshotCollector(vietnam, benchmark, CONFIG, store, CLOCK);
    }

    @Test
    @DisplayName("Snapshot is dated in Vietnam time with both dealer prices")
    void snapshotDate() throws Exception {
        var history = collector().collect();

        var snapshot = history.snapshots().get(0);
        double intl = PremiumCalculator.benchmarkVndPerTael(2000, 25_000);
        assertThat(snapshot.date()).isEqualTo(LocalDate.of(2024, 5, 2));
        assertThat(snapshot.sjcMieng().sell()).isEqualTo(82e6);
        assertThat(snapshot.sjcNhan().buy()).isEqualTo(78e6);
        assertThat(snapshot.international().vndPerTael()).isCloseTo(intl, within(1e-6));
        assertThat(snapshot.premium()).isCloseTo((82e6 - intl) / intl * 100, within(1e-9));
        assertThat(snapshot.exchangeRate()).isEqualTo(25_000.0);
    }

    @Test
    @DisplayName("A second run on the same date replaces that entry")
    void replacesSameDate() throws Exception {
        var earlier = new DailySnapshot(LocalDate.of(2024, 4, 30), Instant.parse("2024-04-30T03:00:00Z"),
            null, null, new DailySnapshot.InternationalPrice(1990, 60e6), 25_000, null);
        store.writeJson(VietnamHistory.FILE_NAME, VietnamHistory.empty().with(earlier, earlier.timestamp()));

        collector().collect();
        when(vietnam.fetch()).thenReturn(FetchResult.success(List.of(
            RawQuote.buySell("SJC Miếng", "Vietnam", "VND", 81e6, 83e6, CLOCK.instant()))));
        var history = collector().collect();

        assertThat(history.snapshots()).extracting(DailySnapshot::date)
            .containsExactly(LocalDate.of(2024, 4, 30), LocalDate.of(2024, 5, 2));
        assertThat(history.snapshots().get(1).sjcMieng().sell()).isEqualTo(83e6);
        assertThat(store.readJson(VietnamHistory.FILE_NAME, VietnamHistory.class).snapshots()).hasSize(2);
    }

    @Test
    @DisplayName("Vietnam failure still records the international price without a premium")
    void vietnamFailure() throws Exception {
        when(vietnam.fetch()).thenReturn(FetchResult.failure("giavang.org: HTTP 503"));

        var snapshot = collector().collect().snapshots().get(0);

        assertThat(snapshot.sjcMieng()).isNull();
        assertThat(snapshot.premium()).isNull();
        assertThat(snapshot.international().usdPerOunce()).isEqualTo(2000.0);
    }

    @Test
    @DisplayName("International failure aborts the snapshot")
    void internationalFailure() {
        when(benchmark.fetch()).thenReturn(FetchResult.failure("all sources failed"));

        assertThatThrownBy(() -> collector().collect())
            .isInstanceOf(AcquisitionException.class)
            .hasMessage("International price unavailable: all sources failed");
        assertThat(store.exists(VietnamHistory.FILE_NAME)).isFalse();
    }
}

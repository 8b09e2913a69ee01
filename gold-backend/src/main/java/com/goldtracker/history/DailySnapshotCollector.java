package com.goldtracker.history;

import com.goldtracker.acquisition.AcquisitionException;
import com.goldtracker.acquisition.AcquisitionOrchestrator;
import com.goldtracker.api.PriceSource;
import com.goldtracker.api.model.RawQuote;
import com.goldtracker.config.Config;
import com.goldtracker.persistence.ArtifactStore;
import com.goldtracker.pricing.PremiumCalculator;
import com.goldtracker.pricing.PremiumResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Appends today's Vietnam snapshot to the daily log. "Today" is the Vietnam calendar
 * date; a second run on the same date refreshes that day's entry.
 */
public final class DailySnapshotCollector {
    private static final Logger logger = LoggerFactory.getLogger(DailySnapshotCollector.class);

    static final ZoneId VIETNAM_ZONE = ZoneId.of("Asia/Ho_Chi_Minh");

    private final PriceSource vietnam;
    private final PriceSource benchmark;
    private final Config config;
    private final ArtifactStore store;
    private final Clock clock;

    public DailySnapshotCollector(PriceSource vietnam, PriceSource benchmark, Config config, ArtifactStore store) {
        this(vietnam, benchmark, config, store, Clock.systemUTC());
    }

    DailySnapshotCollector(PriceSource vietnam, PriceSource benchmark, Config config,
                           ArtifactStore store, Clock clock) {
        this.vietnam = vietnam;
        this.benchmark = benchmark;
        this.config = config;
        this.store = store;
        this.clock = clock;
    }

    public VietnamHistory collect() throws AcquisitionException, IOException {
        var today = LocalDate.now(clock.withZone(VIETNAM_ZONE));
        var existing = store.readJsonIfPresent(VietnamHistory.FILE_NAME, VietnamHistory.class)
            .orElseGet(VietnamHistory::empty);
        if (existing.hasDate(today)) {
            logger.info("Refreshing existing snapshot for {}", today);
        }

        var snapshot = snapshot(today);
        var updated = existing.with(snapshot, clock.instant());
        store.writeJson(VietnamHistory.FILE_NAME, updated);

        logger.info("Saved snapshot for {}: SJC Miếng {} VND, international {} VND/tael, premium {}, {} total",
            today,
            snapshot.sjcMieng() != null ? String.format("%,.0f", snapshot.sjcMieng().sell()) : "N/A",
            String.format("%,.0f", snapshot.international().vndPerTael()),
            snapshot.premium() != null ? String.format("%.2f%%", snapshot.premium()) : "N/A",
            updated.snapshots().size());
        return updated;
    }

    DailySnapshot snapshot(LocalDate today) throws AcquisitionException {
        var international = benchmark.fetch();
        if (!international.isSuccess()) {
            throw new AcquisitionException("International price unavailable: " + international.error());
        }
        double usdPerOunce = AcquisitionOrchestrator.benchmarkUsdPerOunce(international.data());
        double rate = config.historicalExchangeRate();
        double intlVndPerTael = PremiumCalculator.benchmarkVndPerTael(usdPerOunce, rate);

        List<RawQuote> local = List.of();
        var vietnamResult = vietnam.fetch();
        if (vietnamResult.isSuccess()) {
            local = vietnamResult.data();
        } else {
            logger.warn("Vietnam quotes unavailable: {}", vietnamResult.error());
        }

        var mieng = dealerQuote(local, "Miếng");
        var nhan = dealerQuote(local, "Nhẫn");
        Double premium = mieng
            .flatMap(q -> PremiumCalculator.premium(q.sellPrice(), intlVndPerTael))
            .map(PremiumResult::premiumPercent)
            .orElse(null);

        return new DailySnapshot(
            today,
            clock.instant(),
            mieng.map(DailySnapshotCollector::dealerPrice).orElse(null),
            nhan.map(DailySnapshotCollector::dealerPrice).orElse(null),
            new DailySnapshot.InternationalPrice(usdPerOunce, intlVndPerTael),
            rate,
            premium);
    }

    private static Optional<RawQuote> dealerQuote(List<RawQuote> quotes, String goldType) {
        return quotes.stream()
            .filter(q -> q.source().contains(goldType) && q.sellPrice() != null)
            .findFirst();
    }

    private static DailySnapshot.DealerPrice dealerPrice(RawQuote quote) {
        return new DailySnapshot.DealerPrice(quote.buyPrice(), quote.sellPrice());
    }
}

package com.goldtracker.analysis;

import com.goldtracker.api.model.HistoricalPoint;
import com.goldtracker.history.HistoryArtifact;
import com.goldtracker.history.LongHistoryArtifact;
import com.goldtracker.persistence.ArtifactStore;
import com.goldtracker.pricing.NormalizedQuote;
import com.goldtracker.pricing.QuoteSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Combines the quote snapshot, recent history, optional five-year history and optional
 * drawdown report into {@link MarketSignals}.
 */
public final class SignalService {
    private static final Logger logger = LoggerFactory.getLogger(SignalService.class);

    static final String FIVE_YEAR_FILE = LongHistoryArtifact.fileName(5);

    private final ArtifactStore store;

    public SignalService(ArtifactStore store) {
        this.store = store;
    }

    public MarketSignals generate() throws IOException {
        var latest = store.readJson(QuoteSnapshot.FILE_NAME, QuoteSnapshot.class);
        var history = store.readJson(HistoryArtifact.FILE_NAME, HistoryArtifact.class);
        var fiveYear = store.readJsonIfPresent(FIVE_YEAR_FILE, LongHistoryArtifact.class);
        var drawdowns = store.readJsonIfPresent(DrawdownReport.FILE_NAME, DrawdownReport.class);

        if (fiveYear.isEmpty()) logger.info("No {}; percentile omitted", FIVE_YEAR_FILE);
        if (drawdowns.isEmpty()) logger.info("No {}; drawdown digest omitted", DrawdownReport.FILE_NAME);

        return compute(latest, history, fiveYear, drawdowns);
    }

    /**
     * @throws IllegalStateException if the recent history has no points
     */
    public static MarketSignals compute(QuoteSnapshot latest, HistoryArtifact history,
                                        Optional<LongHistoryArtifact> fiveYear,
                                        Optional<DrawdownReport> drawdowns) {
        if (history.data() == null || history.data().isEmpty()) {
            throw new IllegalStateException(HistoryArtifact.FILE_NAME + " has no data points");
        }
        double[] prices = history.data().values(HistoricalPoint::vndPerTael);

        Double percentile = fiveYear
            .filter(h -> h.data() != null && !h.data().isEmpty())
            .map(h -> boxed(PriceStatistics.percentileRank(h.data().values(HistoricalPoint::vndPerTael)), 0))
            .orElse(null);

        return new MarketSignals(
            latest.timestamp(),
            sjcQuote(latest).map(NormalizedQuote::vndPerTael).orElse(null),
            quoteFor(latest, "International").map(NormalizedQuote::vndPerTael).orElse(null),
            Optional.ofNullable(latest.vietnamPremium()).map(p -> round(p.premiumPercent(), 2)).orElse(null),
            boxed(PriceStatistics.changeOver(prices, 7), 2),
            boxed(PriceStatistics.changeOver(prices, 30), 2),
            boxed(PriceStatistics.volatility(prices), 2),
            boxed(PriceStatistics.movingAverage(prices, 7), 0),
            boxed(PriceStatistics.movingAverage(prices, 30), 0),
            percentile,
            drawdowns.map(r -> MarketSignals.DrawdownDigest.of(r.summary())).orElse(null));
    }

    private static Optional<NormalizedQuote> sjcQuote(QuoteSnapshot latest) {
        return latest.normalized().stream()
            .filter(q -> q.country().equals("Vietnam") && q.source().contains("Miếng"))
            .findFirst()
            .or(() -> quoteFor(latest, "Vietnam"));
    }

    private static Optional<NormalizedQuote> quoteFor(QuoteSnapshot latest, String country) {
        return latest.normalized().stream().filter(q -> q.country().equals(country)).findFirst();
    }

    private static Double boxed(OptionalDouble value, int decimals) {
        return value.isPresent() ? round(value.getAsDouble(), decimals) : null;
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}

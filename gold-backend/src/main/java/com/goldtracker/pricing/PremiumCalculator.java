package com.goldtracker.pricing;

import com.goldtracker.acquisition.AggregateResult;
import com.goldtracker.acquisition.Market;
import com.goldtracker.api.model.RawQuote;
import com.goldtracker.config.GoldUnits;

import java.util.Comparator;
import java.util.Optional;

/**
 * Premium of a local price over the international benchmark. An absent result means
 * "no signal" and is never reported as a zero premium.
 */
public final class PremiumCalculator {

    private PremiumCalculator() {
    }

    public static Optional<PremiumResult> premium(Double localVndPerTael, Double benchmarkVndPerTael) {
        if (localVndPerTael == null || benchmarkVndPerTael == null || !(benchmarkVndPerTael > 0)) {
            return Optional.empty();
        }
        double percent = (localVndPerTael - benchmarkVndPerTael) / benchmarkVndPerTael * 100;
        return Optional.of(new PremiumResult(percent, benchmarkVndPerTael, localVndPerTael));
    }

    public static double benchmarkVndPerTael(double usdPerOunce, double usdToVnd) {
        return GoldUnits.gramToTael(GoldUnits.ounceToGram(usdPerOunce) * usdToVnd);
    }

    /**
     * SJC sell price against the cycle's benchmark. Bar (Miếng) quotes are preferred over ring.
     */
    public static Optional<PremiumResult> vietnamPremium(AggregateResult result) {
        Double local = sjcQuote(result).map(RawQuote::sellPrice).orElse(null);
        if (!result.has(Market.INTERNATIONAL)) {
            return Optional.empty();
        }
        double benchmark = benchmarkVndPerTael(result.benchmarkUsdPerOunce(), result.rates().usdToVnd());
        return premium(local, benchmark);
    }

    static Optional<RawQuote> sjcQuote(AggregateResult result) {
        return result.quotes(Market.VIETNAM).stream()
            .filter(q -> q.source().toLowerCase().contains("sjc") && q.sellPrice() != null)
            .min(Comparator.comparingInt(q -> q.source().contains("Miếng") ? 0 : 1));
    }
}

package com.goldtracker.api.sources;

import com.goldtracker.api.FetchResult;
import com.goldtracker.api.PriceSource;
import com.goldtracker.api.model.ExchangeRateTable;
import com.goldtracker.api.model.RawQuote;

import java.time.Instant;
import java.util.List;

/**
 * Local-currency quote derived from the international benchmark and the cycle's
 * exchange-rate table. Used as the last resort for markets without a direct feed.
 */
public final class CalculatedQuoteSource implements PriceSource {

    private final String country;
    private final String currency;
    private final Double benchmarkUsdPerOunce;
    private final ExchangeRateTable rates;

    public CalculatedQuoteSource(String country, String currency,
                                 Double benchmarkUsdPerOunce, ExchangeRateTable rates) {
        this.country = country;
        this.currency = currency;
        this.benchmarkUsdPerOunce = benchmarkUsdPerOunce;
        this.rates = rates;
    }

    @Override
    public String name() {
        return "Calculated (XAUUSD × USD/" + currency + ")";
    }

    @Override
    public boolean isAvailable() {
        return benchmarkUsdPerOunce != null && rates != null;
    }

    @Override
    public FetchResult<List<RawQuote>> fetch() {
        if (!isAvailable()) {
            return FetchResult.failure(name() + ": no benchmark price");
        }
        var rate = rates.rate(currency);
        if (rate.isEmpty()) {
            return FetchResult.failure(currency + " rate not found");
        }
        double pricePerOunce = benchmarkUsdPerOunce * rate.getAsDouble();
        return FetchResult.success(List.of(
            RawQuote.perOunce(name(), country, currency, pricePerOunce, Instant.now())));
    }
}

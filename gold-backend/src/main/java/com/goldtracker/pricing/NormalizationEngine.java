package com.goldtracker.pricing;

import com.goldtracker.api.model.ExchangeRateTable;
import com.goldtracker.api.model.RawQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts raw quotes to VND per gram and per tael.
 *
 * The per-gram price comes from the quote's {@link com.goldtracker.api.model.QuoteShape}.
 * Currency conversion: VND passes through, USD is multiplied by the VND rate, anything
 * else goes through USD first. Quotes that cannot be converted are dropped with a warning.
 */
public final class NormalizationEngine {
    private static final Logger logger = LoggerFactory.getLogger(NormalizationEngine.class);

    public NormalizationResult normalize(List<RawQuote> quotes, ExchangeRateTable rates) {
        double usdToVnd = rates.usdToVnd();
        var normalized = new ArrayList<NormalizedQuote>();
        var warnings = new ArrayList<String>();

        for (RawQuote quote : quotes) {
            var shape = quote.shape();
            if (shape.isEmpty()) {
                warnings.add("Dropped " + quote.source() + ": no usable price field");
                continue;
            }
            double pricePerGram = shape.get().pricePerGram();

            var vndPerGram = toVnd(pricePerGram, quote.currency(), rates, usdToVnd);
            if (vndPerGram.isEmpty()) {
                warnings.add("Dropped " + quote.source() + ": no exchange rate for " + quote.currency());
                continue;
            }

            normalized.add(new NormalizedQuote(quote.source(), quote.country(), quote.currency(),
                pricePerGram, vndPerGram.get()));
        }

        warnings.forEach(w -> logger.warn("Data quality: {}", w));
        return new NormalizationResult(normalized, warnings);
    }

    private static Optional<Double> toVnd(double pricePerGram, String currency,
                                          ExchangeRateTable rates, double usdToVnd) {
        if (ExchangeRateTable.VND.equalsIgnoreCase(currency)) {
            return Optional.of(pricePerGram);
        }
        if (ExchangeRateTable.USD.equalsIgnoreCase(currency)) {
            return Optional.of(pricePerGram * usdToVnd);
        }
        var rate = rates.rate(currency);
        if (rate.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(pricePerGram / rate.getAsDouble() * usdToVnd);
    }
}

package com.goldtracker.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.goldtracker.config.GoldUnits;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One provider's observation of a gold price, in the provider's own currency and unit.
 * At least one price field is populated. Unset fields are null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RawQuote(
    String source,
    String country,
    String currency,
    Double pricePerGram,
    Double pricePerOunce,
    Double pricePerTael,
    Double buyPrice,
    Double sellPrice,
    Instant timestamp
) {

    public RawQuote {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(country, "country");
        Objects.requireNonNull(currency, "currency");
        Objects.requireNonNull(timestamp, "timestamp");
        if (pricePerGram == null && pricePerOunce == null && pricePerTael == null
                && buyPrice == null && sellPrice == null) {
            throw new IllegalArgumentException("Quote from " + source + " has no price field");
        }
    }

    /**
     * Quote priced per troy ounce; the per-gram price is derived from it.
     */
    public static RawQuote perOunce(String source, String country, String currency,
                                    double pricePerOunce, Instant timestamp) {
        return new RawQuote(source, country, currency,
            GoldUnits.ounceToGram(pricePerOunce), pricePerOunce,
            null, null, null, timestamp);
    }

    public static RawQuote perGram(String source, String country, String currency,
                                   double pricePerGram, Instant timestamp) {
        return new RawQuote(source, country, currency, pricePerGram, null, null, null, null, timestamp);
    }

    public static RawQuote perTael(String source, String country, String currency,
                                   double pricePerTael, Instant timestamp) {
        return new RawQuote(source, country, currency, null, null, pricePerTael, null, null, timestamp);
    }

    /**
     * Dealer quote with buy and sell prices per tael. The sell price doubles as the tael price.
     */
    public static RawQuote buySell(String source, String country, String currency,
                                   double buyPrice, double sellPrice, Instant timestamp) {
        return new RawQuote(source, country, currency, null, null, sellPrice, buyPrice, sellPrice, timestamp);
    }

    /**
     * The shape that decides how a per-gram price is derived, or empty when none applies.
     * Priority: per-gram, then per-tael, then sell price.
     */
    @JsonIgnore
    public Optional<QuoteShape> shape() {
        if (pricePerGram != null && pricePerGram > 0) {
            return Optional.of(new QuoteShape.PerGram(pricePerGram));
        }
        if (pricePerTael != null && pricePerTael > 0) {
            return Optional.of(new QuoteShape.PerTael(pricePerTael));
        }
        if (sellPrice != null && sellPrice > 0) {
            return Optional.of(new QuoteShape.BuySell(buyPrice, sellPrice));
        }
        return Optional.empty();
    }
}

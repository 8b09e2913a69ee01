package com.goldtracker.api.model;

import com.goldtracker.config.GoldUnits;

/**
 * How a raw quote states its price. Each shape knows how to reach a per-gram price
 * in the quote's own currency.
 */
public sealed interface QuoteShape permits QuoteShape.PerGram, QuoteShape.PerTael, QuoteShape.BuySell {

    double pricePerGram();

    record PerGram(double value) implements QuoteShape {
        @Override
        public double pricePerGram() {
            return value;
        }
    }

    record PerTael(double pricePerTael) implements QuoteShape {
        @Override
        public double pricePerGram() {
            return GoldUnits.taelToGram(pricePerTael);
        }
    }

    /**
     * Dealer buy/sell quote per tael; the sell side is the reference price.
     */
    record BuySell(Double buyPrice, double sellPrice) implements QuoteShape {
        @Override
        public double pricePerGram() {
            return GoldUnits.taelToGram(sellPrice);
        }
    }
}

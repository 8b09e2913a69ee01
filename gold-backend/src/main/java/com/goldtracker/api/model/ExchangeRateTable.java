package com.goldtracker.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Units of each currency per 1 USD. USD is always present with rate 1.
 */
public final class ExchangeRateTable {
    public static final String USD = "USD";
    public static final String VND = "VND";

    private final Map<String, Double> rates;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ExchangeRateTable(Map<String, Double> rates) {
        var copy = new TreeMap<String, Double>();
        rates.forEach((currency, rate) -> {
            if (rate == null || !(rate > 0)) {
                throw new IllegalArgumentException("Invalid rate for " + currency + ": " + rate);
            }
            copy.put(currency.toUpperCase(), rate);
        });
        copy.put(USD, 1.0);
        this.rates = Collections.unmodifiableMap(copy);
    }

    public OptionalDouble rate(String currency) {
        Double rate = rates.get(currency.toUpperCase());
        return rate != null ? OptionalDouble.of(rate) : OptionalDouble.empty();
    }

    public boolean contains(String currency) {
        return rates.containsKey(currency.toUpperCase());
    }

    /**
     * The USD to VND rate. Throws IllegalStateException if the table has none.
     */
    public double usdToVnd() {
        return rate(VND).orElseThrow(() -> new IllegalStateException("No USD/VND rate in table"));
    }

    @JsonValue
    public Map<String, Double> asMap() {
        return rates;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExchangeRateTable other && rates.equals(other.rates);
    }

    @Override
    public int hashCode() {
        return rates.hashCode();
    }

    @Override
    public String toString() {
        return "ExchangeRateTable" + rates;
    }
}

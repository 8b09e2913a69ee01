package com.goldtracker.acquisition;

import com.goldtracker.api.model.ExchangeRateTable;
import com.goldtracker.api.model.RawQuote;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one acquisition cycle produced. Markets that failed are absent from
 * {@code quotes} and have one entry in {@code warnings}.
 */
public record AggregateResult(
    Instant fetchedAt,
    ExchangeRateTable rates,
    double benchmarkUsdPerOunce,
    Map<Market, List<RawQuote>> quotes,
    List<String> warnings
) {

    public AggregateResult {
        var copy = new EnumMap<Market, List<RawQuote>>(Market.class);
        quotes.forEach((market, list) -> copy.put(market, List.copyOf(list)));
        quotes = Collections.unmodifiableMap(copy);
        warnings = List.copyOf(warnings);
    }

    public List<RawQuote> quotes(Market market) {
        return quotes.getOrDefault(market, List.of());
    }

    public boolean has(Market market) {
        return !quotes(market).isEmpty();
    }

    /**
     * All quotes in market order.
     */
    public List<RawQuote> allQuotes() {
        var all = new ArrayList<RawQuote>();
        quotes.values().forEach(all::addAll);
        return all;
    }

    public AggregateResult withQuotes(Map<Market, List<RawQuote>> replacement) {
        return new AggregateResult(fetchedAt, rates, benchmarkUsdPerOunce, replacement, warnings);
    }
}

package com.goldtracker.acquisition;

import com.goldtracker.api.model.RawQuote;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trims each market's raw quotes to the ones worth normalizing.
 */
public final class QuoteCurator {

    private QuoteCurator() {
    }

    public static AggregateResult curate(AggregateResult result) {
        var curated = new EnumMap<Market, List<RawQuote>>(Market.class);
        result.quotes().forEach((market, quotes) -> curated.put(market, curate(market, quotes)));
        return result.withQuotes(curated);
    }

    public static List<RawQuote> curate(Market market, List<RawQuote> quotes) {
        return switch (market) {
            case INTERNATIONAL -> quotes;
            case VIETNAM -> distinctByPrice(quotes);
            case CHINA, RUSSIA -> distinctBySource(quotes);
            case INDIA -> pickIndia(quotes);
        };
    }

    // First quote per sell / tael price; per-gram-only quotes key on their gram price
    static List<RawQuote> distinctByPrice(List<RawQuote> quotes) {
        var unique = new LinkedHashMap<Double, RawQuote>();
        for (RawQuote quote : quotes) {
            Double key = quote.sellPrice() != null ? quote.sellPrice()
                : quote.pricePerTael() != null ? quote.pricePerTael()
                : quote.pricePerGram();
            unique.putIfAbsent(key, quote);
        }
        return new ArrayList<>(unique.values());
    }

    static List<RawQuote> distinctBySource(List<RawQuote> quotes) {
        var unique = new LinkedHashMap<String, RawQuote>();
        for (RawQuote quote : quotes) {
            var existing = unique.get(quote.source());
            if (existing == null || (quote.sellPrice() != null && existing.sellPrice() == null)) {
                unique.put(quote.source(), quote);
            }
        }
        return new ArrayList<>(unique.values());
    }

    static List<RawQuote> pickIndia(List<RawQuote> quotes) {
        if (quotes.isEmpty()) {
            return quotes;
        }
        return quotes.stream()
            .filter(q -> q.source().toLowerCase().contains("gold 999"))
            .findFirst()
            .or(() -> quotes.stream().findFirst())
            .map(List::of)
            .orElse(List.of());
    }
}

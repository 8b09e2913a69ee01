package com.goldtracker.api.sources;

import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.HttpPriceSource;
import com.goldtracker.api.model.RawQuote;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * India Bullion and Jewellers Association rate table. Rates are published per 10 grams.
 */
public final class IbjaSource extends HttpPriceSource {
    static final String URL = "https://ibjarates.com/";

    private static final double GRAMS_PER_QUOTE = 10;

    public IbjaSource(HttpFetcher fetcher) {
        super(fetcher);
    }

    @Override
    public String name() {
        return "IBJA";
    }

    @Override
    protected String url() {
        return URL;
    }

    @Override
    protected List<RawQuote> parse(String body) {
        var document = Jsoup.parse(body);
        var quotes = new ArrayList<RawQuote>();
        var now = Instant.now();

        for (Element row : document.select("table tr")) {
            var cells = row.select("td");
            if (cells.size() < 2) continue;

            String label = cells.get(0).text().trim().toLowerCase();
            if (!(label.contains("gold") || label.contains("999") || label.contains("995"))) continue;

            double price = digits(cells.get(1).text());
            if (price > 0) {
                quotes.add(RawQuote.perGram("IBJA-" + label, "India", "INR", price / GRAMS_PER_QUOTE, now));
            }
        }
        return quotes;
    }

    private static double digits(String text) {
        String cleaned = text.replaceAll("[^0-9.]", "");
        try {
            return cleaned.isEmpty() ? 0 : Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}

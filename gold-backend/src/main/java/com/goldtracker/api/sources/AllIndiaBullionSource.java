package com.goldtracker.api.sources;

import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.HttpPriceSource;
import com.goldtracker.api.model.RawQuote;
import org.jsoup.Jsoup;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * allindiabullion.com 24K rate scraped from page text, INR per gram.
 */
public final class AllIndiaBullionSource extends HttpPriceSource {
    static final String URL = "https://allindiabullion.com/";

    private static final Pattern RUPEE_PRICE = Pattern.compile(
        "(?:₹|Rs\\.?|INR)\\s*(\\d{1,2},?\\d{3}(?:\\.\\d{2})?)", Pattern.CASE_INSENSITIVE);
    private static final double MIN_INR_PER_GRAM = 5000;
    private static final double MAX_INR_PER_GRAM = 10000;

    public AllIndiaBullionSource(HttpFetcher fetcher) {
        super(fetcher);
    }

    @Override
    public String name() {
        return "AllIndiaBullion";
    }

    @Override
    protected String url() {
        return URL;
    }

    @Override
    protected List<RawQuote> parse(String body) {
        var document = Jsoup.parse(body);
        var quotes = new ArrayList<RawQuote>();
        var seen = new HashSet<Double>();
        var now = Instant.now();

        for (var element : document.body().getAllElements()) {
            String text = element.ownText();
            if (!(text.contains("24K") || text.contains("24 Karat") || text.contains("999"))) continue;

            var matcher = RUPEE_PRICE.matcher(text);
            if (!matcher.find()) continue;

            double price = Double.parseDouble(matcher.group(1).replace(",", ""));
            if (price <= MIN_INR_PER_GRAM || price >= MAX_INR_PER_GRAM) continue;
            if (seen.add(price)) {
                quotes.add(RawQuote.perGram("AIB-24K", "India", "INR", price, now));
            }
        }
        return quotes;
    }
}

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
 * goldpricez.com Vietnam per-gram page. Only values in a plausible VND-per-gram band are kept.
 */
public final class GoldPricezSource extends HttpPriceSource {
    static final String URL = "https://goldpricez.com/vn/gram";

    private static final Pattern VND_PRICE = Pattern.compile(
        "(\\d{1,3}(?:,\\d{3})*(?:\\.\\d+)?)\\s*(?:₫|VND|đ)", Pattern.CASE_INSENSITIVE);
    private static final double MIN_VND_PER_GRAM = 1_000_000;
    private static final double MAX_VND_PER_GRAM = 5_000_000;

    public GoldPricezSource(HttpFetcher fetcher) {
        super(fetcher);
    }

    @Override
    public String name() {
        return "goldpricez.com";
    }

    @Override
    protected String url() {
        return URL;
    }

    @Override
    protected List<RawQuote> parse(String body) {
        var document = Jsoup.parse(body);
        var quotes = new ArrayList<RawQuote>();
        var seen = new HashSet<Long>();
        var now = Instant.now();

        for (var element : document.select("[class*=price], [class*=rate], [class*=gold]")) {
            var matcher = VND_PRICE.matcher(element.text());
            if (!matcher.find()) continue;

            double price = Double.parseDouble(matcher.group(1).replace(",", ""));
            if (price <= MIN_VND_PER_GRAM || price >= MAX_VND_PER_GRAM) continue;
            if (!seen.add(Math.round(price))) continue;

            quotes.add(RawQuote.perGram("GoldPricez-VN", "Vietnam", "VND", price, now));
        }
        return quotes;
    }
}

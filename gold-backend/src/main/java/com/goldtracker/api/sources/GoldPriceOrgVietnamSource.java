package com.goldtracker.api.sources;

import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.HttpPriceSource;
import com.goldtracker.api.model.RawQuote;
import org.jsoup.Jsoup;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * goldprice.org Vietnam page: spot converted to VND per gram and per ounce.
 */
public final class GoldPriceOrgVietnamSource extends HttpPriceSource {
    static final String URL = "https://goldprice.org/gold-price-vietnam.html";

    private static final Pattern PER_GRAM = Pattern.compile(
        "(\\d{1,3}(?:,\\d{3})*(?:\\.\\d+)?)\\s*VND\\s*(?:per|/)\\s*(?:gram|g)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PER_OUNCE = Pattern.compile(
        "(\\d{1,3}(?:,\\d{3})*(?:\\.\\d+)?)\\s*VND\\s*(?:per|/)\\s*(?:ounce|oz)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMBEDDED_PRICE = Pattern.compile(
        "[\"']price[\"']\\s*:\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE);

    // Embedded prices above this are VND per ounce
    private static final double EMBEDDED_OUNCE_FLOOR = 1_000_000;

    public GoldPriceOrgVietnamSource(HttpFetcher fetcher) {
        super(fetcher);
    }

    @Override
    public String name() {
        return "goldprice.org-VN";
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
        String text = document.body().text();

        var gram = PER_GRAM.matcher(text);
        if (gram.find()) {
            quotes.add(RawQuote.perGram("GoldPriceOrg-VN", "Vietnam", "VND", number(gram.group(1)), now));
        }

        var ounce = PER_OUNCE.matcher(text);
        if (ounce.find()) {
            quotes.add(RawQuote.perOunce("GoldPriceOrg-VN-Oz", "Vietnam", "VND", number(ounce.group(1)), now));
        }

        for (var script : document.select("script")) {
            var embedded = EMBEDDED_PRICE.matcher(script.data());
            if (embedded.find()) {
                double price = Double.parseDouble(embedded.group(1));
                if (price > EMBEDDED_OUNCE_FLOOR) {
                    quotes.add(RawQuote.perOunce("GoldPriceOrg-Embedded", "Vietnam", "VND", price, now));
                }
            }
        }
        return quotes;
    }

    private static double number(String text) {
        return Double.parseDouble(text.replace(",", ""));
    }
}

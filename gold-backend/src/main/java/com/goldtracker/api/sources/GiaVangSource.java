package com.goldtracker.api.sources;

import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.HttpPriceSource;
import com.goldtracker.api.model.RawQuote;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * giavang.org SJC dealer board. Headings switch between bar (Miếng) and ring (Nhẫn)
 * tables; rows quote buy/sell in thousands of VND per tael.
 */
public final class GiaVangSource extends HttpPriceSource {
    static final String URL = "https://giavang.org/";

    public GiaVangSource(HttpFetcher fetcher) {
        super(fetcher);
    }

    @Override
    public String name() {
        return "giavang.org";
    }

    @Override
    protected String url() {
        return URL;
    }

    @Override
    protected List<RawQuote> parse(String body) {
        var document = Jsoup.parse(body);
        var quotes = new ArrayList<RawQuote>();
        var seen = new HashSet<String>();
        var now = Instant.now();
        String goldType = "Miếng";

        for (Element element : document.select("h2, table")) {
            if (element.tagName().equals("h2")) {
                String heading = element.text().toLowerCase();
                if (heading.contains("nhẫn")) {
                    goldType = "Nhẫn";
                } else if (heading.contains("miếng")) {
                    goldType = "Miếng";
                }
                continue;
            }

            for (Element row : element.select("tr")) {
                var cells = row.select("td");
                if (cells.size() < 3) continue;

                String label = cells.get(0).text().trim();
                double buy = parseThousands(cells.get(1).text());
                double sell = parseThousands(cells.get(2).text());
                if (buy <= 0 || sell <= 0 || !label.toLowerCase().contains("sjc")) continue;
                if (!seen.add(goldType + "-" + sell)) continue;

                quotes.add(RawQuote.buySell("SJC " + goldType, "Vietnam", "VND",
                    buy * 1000, sell * 1000, now));
            }
        }
        return quotes;
    }

    /**
     * "175.300" or "175,300" to 175300; anything unparseable to 0.
     */
    static double parseThousands(String text) {
        String digits = text.trim().replaceAll("[.,]", "");
        try {
            return Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}

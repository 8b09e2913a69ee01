package com.goldtracker.api.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goldtracker.api.FetchResult;
import com.goldtracker.api.HistorySource;
import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.HttpPriceSource;
import com.goldtracker.api.Json;
import com.goldtracker.api.SourceException;
import com.goldtracker.api.model.RawQuote;
import com.goldtracker.api.model.UsdPricePoint;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * FreeGoldAPI daily XAU/USD feed. Primary international benchmark and history source.
 * The feed is one JSON array of {date, price, source} records, oldest first.
 */
public final class FreeGoldApiSource extends HttpPriceSource implements HistorySource {
    static final String URL = "https://freegoldapi.com/data/latest.json";
    private static final String HISTORY_FEED = "yahoo_finance";

    private final ObjectMapper objectMapper = Json.newMapper();
    private final Clock clock;

    public FreeGoldApiSource(HttpFetcher fetcher) {
        this(fetcher, Clock.systemUTC());
    }

    FreeGoldApiSource(HttpFetcher fetcher, Clock clock) {
        super(fetcher);
        this.clock = clock;
    }

    @Override
    public String name() {
        return "FreeGoldAPI";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    protected String url() {
        return URL;
    }

    @Override
    protected List<RawQuote> parse(String body) throws Exception {
        var records = readRecords(body);
        if (records.isEmpty()) {
            throw new SourceException("No price data in response");
        }

        // Prefer the newest record from a market feed over interpolated ones
        JsonNode latest = null;
        for (var record : records) {
            String feed = record.path("source").asText("");
            if (feed.equals(HISTORY_FEED) || feed.contains("kitco") || feed.contains("lbma")) {
                latest = record;
            }
        }
        if (latest == null) {
            latest = records.get(records.size() - 1);
        }

        double price = latest.path("price").asDouble();
        if (price <= 0) {
            throw new SourceException("Invalid price in latest record: " + latest.path("price").asText("missing"));
        }
        var date = LocalDate.parse(latest.path("date").asText());
        return List.of(RawQuote.perOunce(
            "FreeGoldAPI (" + latest.path("source").asText("unknown") + ")",
            "International", "USD",
            price,
            date.atStartOfDay(ZoneOffset.UTC).toInstant()));
    }

    @Override
    public FetchResult<List<UsdPricePoint>> fetchHistory(int days) {
        try {
            var points = parseHistory(fetcher.get(URL), days);
            if (points.isEmpty()) {
                return FetchResult.failure("No " + HISTORY_FEED + " points in the last " + days + " days");
            }
            return FetchResult.success(points);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(name() + " interrupted");
        } catch (Exception e) {
            return FetchResult.failure(describe(e));
        }
    }

    List<UsdPricePoint> parseHistory(String body, int days) throws Exception {
        var cutoff = LocalDate.now(clock).minusDays(days);
        var points = new ArrayList<UsdPricePoint>();
        for (var record : readRecords(body)) {
            if (!HISTORY_FEED.equals(record.path("source").asText())) continue;
            var date = LocalDate.parse(record.path("date").asText());
            if (date.isBefore(cutoff)) continue;
            points.add(new UsdPricePoint(date, record.path("price").asDouble()));
        }
        return points;
    }

    private List<JsonNode> readRecords(String body) throws Exception {
        JsonNode root = objectMapper.readTree(body);
        if (root == null || !root.isArray()) {
            throw new SourceException("Unexpected FreeGoldAPI payload");
        }
        var records = new ArrayList<JsonNode>();
        root.forEach(records::add);
        return records;
    }
}

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
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * TwelveData daily XAU/USD time series. Needs TWELVEDATA_API_KEY.
 * Values arrive newest first.
 */
public final class TwelveDataSource extends HttpPriceSource implements HistorySource {
    static final String BASE_URL = "https://api.twelvedata.com";
    static final int MAX_OUTPUT_SIZE = 5000;

    private final ObjectMapper objectMapper = Json.newMapper();
    private final Optional<String> apiKey;
    private final Clock clock;

    public TwelveDataSource(HttpFetcher fetcher, Optional<String> apiKey) {
        this(fetcher, apiKey, Clock.systemUTC());
    }

    TwelveDataSource(HttpFetcher fetcher, Optional<String> apiKey, Clock clock) {
        super(fetcher);
        this.apiKey = apiKey;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "TwelveData";
    }

    @Override
    public boolean isAvailable() {
        return apiKey.isPresent();
    }

    @Override
    protected String url() {
        return seriesUrl(1);
    }

    private String seriesUrl(int outputSize) {
        return String.format("%s/time_series?symbol=XAU/USD&interval=1day&outputsize=%d&apikey=%s",
            BASE_URL, outputSize, apiKey.orElse(""));
    }

    @Override
    protected List<RawQuote> parse(String body) throws Exception {
        var values = readValues(body);
        if (values.isEmpty()) {
            throw new SourceException("No data returned");
        }
        var latest = values.get(0);
        var date = LocalDate.parse(latest.path("datetime").asText().substring(0, 10));
        return List.of(RawQuote.perOunce(name(), "International", "USD",
            Double.parseDouble(latest.path("close").asText()),
            date.atStartOfDay(ZoneOffset.UTC).toInstant()));
    }

    @Override
    public FetchResult<List<UsdPricePoint>> fetchHistory(int days) {
        if (!isAvailable()) {
            return FetchResult.failure("TWELVEDATA_API_KEY not set");
        }
        try {
            // Extra points cover weekends and holidays
            int outputSize = Math.min(days + 15, MAX_OUTPUT_SIZE);
            return FetchResult.success(parseHistory(fetcher.get(seriesUrl(outputSize)), days));
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
        for (var value : readValues(body)) {
            var date = LocalDate.parse(value.path("datetime").asText().substring(0, 10));
            if (date.isBefore(cutoff)) continue;
            points.add(new UsdPricePoint(date, Double.parseDouble(value.path("close").asText())));
        }
        Collections.reverse(points);
        return points;
    }

    private List<JsonNode> readValues(String body) throws Exception {
        var root = objectMapper.readTree(body);
        if (!"ok".equals(root.path("status").asText())) {
            throw new SourceException(root.path("message").asText("API error"));
        }
        var values = new ArrayList<JsonNode>();
        root.path("values").forEach(values::add);
        return values;
    }
}

package com.goldtracker.api.sources;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.HttpPriceSource;
import com.goldtracker.api.Json;
import com.goldtracker.api.SourceException;
import com.goldtracker.api.model.RawQuote;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * VNAppMob SJC API, VND per tael. Needs VNAPPMOB_API_KEY.
 */
public final class VnAppMobSource extends HttpPriceSource {
    static final String URL = "https://vapi.vnappmob.com/api/v2/gold/sjc";

    private final ObjectMapper objectMapper = Json.newMapper();
    private final Optional<String> apiKey;

    public VnAppMobSource(HttpFetcher fetcher, Optional<String> apiKey) {
        super(fetcher);
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return "VNAppMob";
    }

    @Override
    public boolean isAvailable() {
        return apiKey.isPresent();
    }

    @Override
    protected String url() {
        return URL;
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of(
            "Authorization", "Bearer " + apiKey.orElse(""),
            "Accept", "application/json");
    }

    @Override
    protected List<RawQuote> parse(String body) throws Exception {
        var results = objectMapper.readTree(body).path("results");
        if (!results.isArray() || results.isEmpty()) {
            throw new SourceException("No data in response");
        }
        var latest = results.get(0);
        double buy = Double.parseDouble(latest.path("buy_1l").asText());
        double sell = Double.parseDouble(latest.path("sell_1l").asText());
        return List.of(RawQuote.buySell("VNAppMob SJC", "Vietnam", "VND", buy, sell, Instant.now()));
    }
}

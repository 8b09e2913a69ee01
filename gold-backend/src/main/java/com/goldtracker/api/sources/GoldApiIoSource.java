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
 * GoldAPI.io spot XAU/USD. Needs GOLDAPI_KEY.
 */
public final class GoldApiIoSource extends HttpPriceSource {
    static final String URL = "https://www.goldapi.io/api/XAU/USD";

    private final ObjectMapper objectMapper = Json.newMapper();
    private final Optional<String> apiKey;

    public GoldApiIoSource(HttpFetcher fetcher, Optional<String> apiKey) {
        super(fetcher);
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return "GoldAPI.io";
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
        return Map.of("x-access-token", apiKey.orElse(""));
    }

    @Override
    protected List<RawQuote> parse(String body) throws Exception {
        var root = objectMapper.readTree(body);
        double price = root.path("price").asDouble(0);
        if (price <= 0) {
            throw new SourceException("No price in GoldAPI.io response");
        }
        long epochSeconds = root.path("timestamp").asLong(Instant.now().getEpochSecond());
        return List.of(RawQuote.perOunce(name(), "International", "USD", price,
            Instant.ofEpochSecond(epochSeconds)));
    }
}

package com.goldtracker.api.sources;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.HttpPriceSource;
import com.goldtracker.api.Json;
import com.goldtracker.api.SourceException;
import com.goldtracker.api.model.RawQuote;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Metals.dev latest gold in INR per gram. Needs METALS_DEV_KEY.
 */
public final class MetalsDevSource extends HttpPriceSource {
    static final String BASE_URL = "https://api.metals.dev/v1/latest";

    private final ObjectMapper objectMapper = Json.newMapper();
    private final Optional<String> apiKey;

    public MetalsDevSource(HttpFetcher fetcher, Optional<String> apiKey) {
        super(fetcher);
        this.apiKey = apiKey;
    }

    @Override
    public String name() {
        return "Metals.dev";
    }

    @Override
    public boolean isAvailable() {
        return apiKey.isPresent();
    }

    @Override
    protected String url() {
        return BASE_URL + "?api_key=" + apiKey.orElse("") + "&currency=INR&unit=gram";
    }

    @Override
    protected List<RawQuote> parse(String body) throws Exception {
        double gold = objectMapper.readTree(body).path("metals").path("gold").asDouble(0);
        if (gold <= 0) {
            throw new SourceException("No gold price in Metals.dev response");
        }
        return List.of(RawQuote.perGram(name(), "India", "INR", gold, Instant.now()));
    }
}

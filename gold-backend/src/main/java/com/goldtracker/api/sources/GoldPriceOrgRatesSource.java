package com.goldtracker.api.sources;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.HttpPriceSource;
import com.goldtracker.api.Json;
import com.goldtracker.api.SourceException;
import com.goldtracker.api.model.RawQuote;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * goldprice.org spot feed for one currency: {@code items[].xauPrice} is price per troy ounce.
 */
public final class GoldPriceOrgRatesSource extends HttpPriceSource {
    static final String BASE_URL = "https://data-asg.goldprice.org/dbXRates/";

    private static final DateTimeFormatter FEED_DATE =
        DateTimeFormatter.ofPattern("MMM d[d]['st']['nd']['rd']['th'] yyyy, hh:mm:ss a z");

    private final ObjectMapper objectMapper = Json.newMapper();
    private final String country;
    private final String currency;

    public GoldPriceOrgRatesSource(HttpFetcher fetcher, String country, String currency) {
        super(fetcher);
        this.country = country;
        this.currency = currency;
    }

    @Override
    public String name() {
        return "GoldPrice.org-" + currency;
    }

    @Override
    protected String url() {
        return BASE_URL + currency;
    }

    @Override
    protected Map<String, String> headers() {
        return Map.of("Accept", "application/json");
    }

    @Override
    protected List<RawQuote> parse(String body) throws Exception {
        var items = objectMapper.readTree(body).path("items");
        if (!items.isArray() || items.isEmpty()) {
            throw new SourceException("No items in response");
        }

        for (JsonNode item : items) {
            if (!currency.equals(item.path("curr").asText())) continue;

            double pricePerOunce = item.path("xauPrice").asDouble(0);
            if (pricePerOunce <= 0) {
                throw new SourceException(currency + " price not positive");
            }
            return List.of(RawQuote.perOunce(name(), country, currency, pricePerOunce,
                timestamp(item.path("date").asText(null))));
        }
        throw new SourceException(currency + " price not found");
    }

    // The feed's date format drifts; fall back to fetch time when it does not parse
    static Instant timestamp(String text) {
        if (text == null || text.isBlank()) {
            return Instant.now();
        }
        try {
            return ZonedDateTime.parse(text, FEED_DATE).toInstant();
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }
}

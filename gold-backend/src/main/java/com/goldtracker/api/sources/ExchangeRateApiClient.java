package com.goldtracker.api.sources;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.goldtracker.api.FetchResult;
import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.HttpPriceSource;
import com.goldtracker.api.Json;
import com.goldtracker.api.model.ExchangeRateTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * exchangerate-api.com latest USD rates, narrowed to the currencies the markets quote in.
 */
public final class ExchangeRateApiClient implements ExchangeRateProvider {
    private static final Logger logger = LoggerFactory.getLogger(ExchangeRateApiClient.class);

    static final String URL = "https://api.exchangerate-api.com/v4/latest/USD";
    static final List<String> CURRENCIES = List.of("VND", "CNY", "RUB", "INR");

    private final HttpFetcher fetcher;
    private final ObjectMapper objectMapper = Json.newMapper();

    public ExchangeRateApiClient(HttpFetcher fetcher) {
        this.fetcher = fetcher;
    }

    @Override
    public String name() {
        return "exchangerate-api.com";
    }

    @Override
    public FetchResult<ExchangeRateTable> fetchRates() {
        try {
            return parse(fetcher.get(URL));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(name() + " interrupted");
        } catch (Exception e) {
            return FetchResult.failure(HttpPriceSource.describe(e));
        }
    }

    FetchResult<ExchangeRateTable> parse(String body) throws Exception {
        var node = objectMapper.readTree(body).path("rates");
        var rates = new LinkedHashMap<String, Double>();
        for (String currency : CURRENCIES) {
            double rate = node.path(currency).asDouble(0);
            if (rate > 0) {
                rates.put(currency, rate);
            } else {
                logger.debug("{}: no {} rate in response", name(), currency);
            }
        }
        return FetchResult.success(new ExchangeRateTable(rates));
    }
}

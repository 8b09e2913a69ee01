package com.goldtracker.api;

import com.goldtracker.api.model.RawQuote;

import java.util.List;
import java.util.Map;

/**
 * Base for sources backed by a single HTTP GET. Converts every failure into a
 * {@link FetchResult.Failure} at this boundary.
 */
public abstract class HttpPriceSource implements PriceSource {

    protected final HttpFetcher fetcher;

    protected HttpPriceSource(HttpFetcher fetcher) {
        this.fetcher = fetcher;
    }

    protected abstract String url();

    protected Map<String, String> headers() {
        return Map.of();
    }

    /**
     * Turn a response body into quotes. An empty result must be reported as a SourceException.
     */
    protected abstract List<RawQuote> parse(String body) throws Exception;

    @Override
    public FetchResult<List<RawQuote>> fetch() {
        try {
            var quotes = parse(fetcher.get(url(), headers()));
            if (quotes.isEmpty()) {
                return FetchResult.failure("No price data from " + name());
            }
            return FetchResult.success(List.copyOf(quotes));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.failure(name() + " interrupted");
        } catch (Exception e) {
            return FetchResult.failure(describe(e));
        }
    }

    public static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}

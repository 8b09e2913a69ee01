package com.goldtracker.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Thin HTTP GET client shared by every provider adapter.
 * Every request is bounded by the configured timeout.
 */
public class HttpFetcher {
    private static final Logger logger = LoggerFactory.getLogger(HttpFetcher.class);
    static final String USER_AGENT = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36";

    private final HttpClient httpClient;
    private final Duration timeout;

    public HttpFetcher(Duration timeout) {
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String get(String url) throws SourceException, IOException, InterruptedException {
        return get(url, Map.of());
    }

    /**
     * GET the url and return the body of a 2xx response.
     *
     * @throws SourceException on any other status, message {@code HTTP <status>}
     */
    public String get(String url, Map<String, String> headers)
            throws SourceException, IOException, InterruptedException {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", USER_AGENT)
                .timeout(timeout)
                .GET();
        headers.forEach(builder::header);

        logger.debug("GET {}", redact(url));
        var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() >= 200 && response.statusCode() < 300) {
            return response.body();
        }
        throw new SourceException("HTTP " + response.statusCode(), response.statusCode());
    }

    /**
     * Strip query-string credentials before a url reaches the logs.
     */
    static String redact(String url) {
        return url.replaceAll("(?i)(api_?key=)[^&]*", "$1***");
    }
}

package com.goldtracker.acquisition;

import com.goldtracker.api.FetchResult;
import com.goldtracker.api.PriceSource;
import com.goldtracker.api.model.ExchangeRateTable;
import com.goldtracker.api.model.RawQuote;
import com.goldtracker.config.GoldUnits;
import com.goldtracker.metrics.MetricsService;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one acquisition cycle.
 *
 * Order:
 * - exchange rates, then the international benchmark (both required)
 * - every dependent market concurrently, each bounded by a time limiter
 *
 * A failed dependent market becomes a warning. The cycle fails only when the
 * rates or benchmark are missing, or when no dependent market produced quotes.
 */
public final class AcquisitionOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(AcquisitionOrchestrator.class);

    private final SourceCatalog catalog;
    private final MetricsService metrics;
    private final TimeLimiterConfig limiterConfig;
    private final int threads;

    public AcquisitionOrchestrator(SourceCatalog catalog, MetricsService metrics,
                                   Duration marketTimeout, int threads) {
        this.catalog = catalog;
        this.metrics = metrics;
        this.threads = threads;
        this.limiterConfig = TimeLimiterConfig.custom()
            .timeoutDuration(marketTimeout)
            .cancelRunningFuture(true)
            .build();
    }

    public AggregateResult acquireAll() throws AcquisitionException {
        var started = Instant.now();
        var rates = fetchRates();
        var benchmarkQuotes = fetchBenchmark();
        double benchmarkUsdPerOunce = benchmarkUsdPerOunce(benchmarkQuotes);
        logger.info("Benchmark XAU/USD {} from {}", String.format("%.2f", benchmarkUsdPerOunce),
            benchmarkQuotes.get(0).source());

        var quotes = new EnumMap<Market, List<RawQuote>>(Market.class);
        quotes.put(Market.INTERNATIONAL, benchmarkQuotes);
        var warnings = new ArrayList<String>();

        var dependent = catalog.dependentMarkets(benchmarkUsdPerOunce, rates);
        var results = fetchConcurrently(dependent);

        results.forEach((market, result) -> {
            if (result.isSuccess()) {
                quotes.put(market, result.data());
                logger.info("{}: {} quote(s)", market.displayName(), result.data().size());
            } else {
                String warning = market.displayName() + ": " + result.error();
                logger.warn("Market unavailable - {}", warning);
                metrics.recordMarketUnavailable(market.displayName());
                warnings.add(warning);
            }
        });

        if (!dependent.isEmpty() && quotes.size() == 1) {
            throw new AcquisitionException("All markets unavailable: " + String.join("; ", warnings));
        }

        logger.info("Acquisition finished in {} ms: {} market(s), {} warning(s)",
            Duration.between(started, Instant.now()).toMillis(), quotes.size(), warnings.size());
        return new AggregateResult(started, rates, benchmarkUsdPerOunce, quotes, warnings);
    }

    private ExchangeRateTable fetchRates() throws AcquisitionException {
        var provider = catalog.exchangeRates();
        var result = metrics.timeFetch(provider.name(), provider::fetchRates);
        if (!result.isSuccess()) {
            throw new AcquisitionException("No exchange rate available: " + result.error());
        }
        var rates = result.data();
        if (!rates.contains(ExchangeRateTable.VND)) {
            throw new AcquisitionException("No exchange rate available: VND missing from " + provider.name());
        }
        return rates;
    }

    private List<RawQuote> fetchBenchmark() throws AcquisitionException {
        var result = catalog.benchmark().fetch();
        if (!result.isSuccess()) {
            throw new AcquisitionException("International benchmark unavailable: " + result.error());
        }
        return result.data();
    }

    /**
     * USD per troy ounce from the first benchmark quote that carries one.
     */
    public static double benchmarkUsdPerOunce(List<RawQuote> quotes) throws AcquisitionException {
        for (RawQuote quote : quotes) {
            if (!"USD".equals(quote.currency())) continue;
            if (quote.pricePerOunce() != null && quote.pricePerOunce() > 0) {
                return quote.pricePerOunce();
            }
            if (quote.pricePerGram() != null && quote.pricePerGram() > 0) {
                return quote.pricePerGram() * GoldUnits.TROY_OUNCE_GRAMS;
            }
        }
        throw new AcquisitionException("International benchmark unavailable: no USD ounce price");
    }

    private LinkedHashMap<Market, FetchResult<List<RawQuote>>> fetchConcurrently(
            Map<Market, PriceSource> markets) {
        var results = new LinkedHashMap<Market, FetchResult<List<RawQuote>>>();
        if (markets.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(threads, markets.size()), daemonThreads("market-fetch"));
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
            daemonThreads("market-timeout"));
        try {
            var futures = new LinkedHashMap<Market, CompletableFuture<FetchResult<List<RawQuote>>>>();
            markets.forEach((market, source) -> {
                var limiter = TimeLimiter.of("market-" + market.name().toLowerCase(), limiterConfig);
                var future = limiter.executeCompletionStage(scheduler,
                        () -> CompletableFuture.supplyAsync(source::fetch, executor))
                    .toCompletableFuture()
                    .exceptionally(e -> FetchResult.failure(describe(e)));
                futures.put(market, future);
            });
            futures.forEach((market, future) -> results.put(market, future.join()));
        } finally {
            executor.shutdownNow();
            scheduler.shutdownNow();
        }
        return results;
    }

    private String describe(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException) {
            return "timed out after " + limiterConfig.getTimeoutDuration().toMillis() + " ms";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static ThreadFactory daemonThreads(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}

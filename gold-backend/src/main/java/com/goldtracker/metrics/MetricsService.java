package com.goldtracker.metrics;

import com.goldtracker.api.FetchResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Metrics for provider calls and market availability.
 *
 * Provides:
 * - Per-source fetch latency and outcome counts
 * - Unavailable-market counts
 * - Prometheus text scrape for the end-of-run log
 *
 * Usage:
 *   var metrics = MetricsService.prometheus();
 *   var result = metrics.timeFetch("FreeGoldAPI", source::fetch);
 */
public final class MetricsService {
    private static final Logger logger = LoggerFactory.getLogger(MetricsService.class);

    public static final String FETCH_TIMER = "gold.source.fetch";
    public static final String RESULT_COUNTER = "gold.source.result";
    public static final String MARKET_UNAVAILABLE = "gold.market.unavailable";

    private final MeterRegistry registry;

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    public static MetricsService prometheus() {
        logger.debug("MetricsService initialized with Prometheus registry");
        return new MetricsService(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * Prometheus-formatted metrics, or an empty string for other registries.
     */
    public String scrape() {
        return registry instanceof PrometheusMeterRegistry prometheus ? prometheus.scrape() : "";
    }

    /**
     * Run one provider call, recording its latency and outcome.
     */
    public <T> FetchResult<T> timeFetch(String source, Supplier<FetchResult<T>> call) {
        var sample = Timer.start(registry);
        FetchResult<T> result = call.get();
        String outcome = result.isSuccess() ? "success" : "failure";
        sample.stop(registry.timer(FETCH_TIMER, "source", source, "outcome", outcome));
        registry.counter(RESULT_COUNTER, "source", source, "outcome", outcome).increment();
        return result;
    }

    public void recordSkipped(String source) {
        registry.counter(RESULT_COUNTER, "source", source, "outcome", "skipped").increment();
    }

    public void recordMarketUnavailable(String market) {
        registry.counter(MARKET_UNAVAILABLE, "market", market).increment();
    }

    public double count(String source, String outcome) {
        var counter = registry.find(RESULT_COUNTER).tags("source", source, "outcome", outcome).counter();
        return counter != null ? counter.count() : 0.0;
    }
}

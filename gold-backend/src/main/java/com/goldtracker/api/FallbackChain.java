package com.goldtracker.api;

import com.goldtracker.api.model.RawQuote;
import com.goldtracker.api.model.UsdPricePoint;
import com.goldtracker.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered list of sources for one market. Sources are tried strictly in order and
 * the first success is returned without touching the rest. Unavailable sources are
 * skipped; when nothing succeeds the last error seen is returned.
 */
public final class FallbackChain implements PriceSource {
    private static final Logger logger = LoggerFactory.getLogger(FallbackChain.class);

    private final String name;
    private final List<PriceSource> sources;
    private final MetricsService metrics;

    public FallbackChain(String name, List<PriceSource> sources, MetricsService metrics) {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("At least one source must be provided");
        }
        this.name = name;
        this.sources = List.copyOf(sources);
        this.metrics = metrics;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public FetchResult<List<RawQuote>> fetch() {
        FetchResult<List<RawQuote>> last = null;

        for (PriceSource source : sources) {
            if (!source.isAvailable()) {
                logger.debug("{}: skipping {} (not configured)", name, source.name());
                metrics.recordSkipped(source.name());
                continue;
            }

            var result = metrics.timeFetch(source.name(), source::fetch);
            if (result.isSuccess()) {
                logger.debug("{}: {} succeeded", name, source.name());
                return result;
            }

            logger.warn("{}: {} failed: {}", name, source.name(), result.error());
            last = result;
        }

        return last != null ? last : FetchResult.failure(name + ": no configured source");
    }

    /**
     * History counterpart of {@link #fetch()} over the same ordering rules.
     */
    public static FetchResult<List<UsdPricePoint>> fetchHistory(List<HistorySource> sources, int days) {
        FetchResult<List<UsdPricePoint>> last = null;

        for (HistorySource source : sources) {
            if (!source.isAvailable()) {
                logger.debug("History: skipping {} (not configured)", source.name());
                continue;
            }
            var result = source.fetchHistory(days);
            if (result.isSuccess() && result.data().isEmpty()) {
                result = FetchResult.failure(source.name() + " returned no history points");
            }
            if (result.isSuccess()) {
                return result;
            }
            logger.warn("History: {} failed: {}", source.name(), result.error());
            last = result;
        }

        return last != null ? last : FetchResult.failure("History: no configured source");
    }
}

package com.goldtracker.api;

import com.goldtracker.api.model.RawQuote;
import com.goldtracker.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every available source of a market and concatenates their quotes.
 * Fails only when no source produced anything; the error then lists every cause.
 */
public final class MergingSource implements PriceSource {
    private static final Logger logger = LoggerFactory.getLogger(MergingSource.class);

    private final String name;
    private final List<PriceSource> sources;
    private final MetricsService metrics;

    public MergingSource(String name, List<PriceSource> sources, MetricsService metrics) {
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
        var quotes = new ArrayList<RawQuote>();
        var errors = new ArrayList<String>();

        for (PriceSource source : sources) {
            if (!source.isAvailable()) {
                metrics.recordSkipped(source.name());
                errors.add(source.name() + " not configured");
                continue;
            }
            var result = metrics.timeFetch(source.name(), source::fetch);
            if (result.isSuccess()) {
                quotes.addAll(result.data());
            } else {
                logger.warn("{}: {} failed: {}", name, source.name(), result.error());
                errors.add(result.error());
            }
        }

        if (quotes.isEmpty()) {
            return FetchResult.failure(String.join("; ", errors));
        }
        logger.debug("{}: merged {} quote(s)", name, quotes.size());
        return FetchResult.success(List.copyOf(quotes));
    }
}

package com.goldtracker.api;

import com.goldtracker.api.model.RawQuote;

import java.util.List;

/**
 * One provider of current gold quotes.
 * Implementations never throw from {@link #fetch()}; failures come back as {@link FetchResult.Failure}.
 */
public interface PriceSource {

    /**
     * Provider name used in logs, warnings and metrics.
     */
    String name();

    /**
     * Whether the source can be attempted at all, e.g. its credential is configured.
     * Unavailable sources are skipped by composites without counting as a failure.
     */
    default boolean isAvailable() {
        return true;
    }

    FetchResult<List<RawQuote>> fetch();
}

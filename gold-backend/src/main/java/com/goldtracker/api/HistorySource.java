package com.goldtracker.api;

import com.goldtracker.api.model.UsdPricePoint;

import java.util.List;

/**
 * Provider of daily international (USD per troy ounce) closing prices.
 */
public interface HistorySource {

    String name();

    default boolean isAvailable() {
        return true;
    }

    /**
     * Daily prices covering roughly the last {@code days} calendar days, oldest first.
     */
    FetchResult<List<UsdPricePoint>> fetchHistory(int days);
}

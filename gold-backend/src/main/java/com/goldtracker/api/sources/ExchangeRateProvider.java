package com.goldtracker.api.sources;

import com.goldtracker.api.FetchResult;
import com.goldtracker.api.model.ExchangeRateTable;

/**
 * Source of the cycle's USD-based exchange-rate table.
 */
public interface ExchangeRateProvider {

    String name();

    FetchResult<ExchangeRateTable> fetchRates();
}

package com.goldtracker.acquisition;

import com.goldtracker.api.PriceSource;
import com.goldtracker.api.model.ExchangeRateTable;
import com.goldtracker.api.sources.ExchangeRateProvider;

import java.util.Map;

/**
 * The sources one acquisition cycle draws from. Dependent markets are built after the
 * benchmark and exchange rates are known, since their fallbacks are calculated from them.
 */
public interface SourceCatalog {

    ExchangeRateProvider exchangeRates();

    PriceSource benchmark();

    Map<Market, PriceSource> dependentMarkets(double benchmarkUsdPerOunce, ExchangeRateTable rates);
}

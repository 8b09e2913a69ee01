package com.goldtracker.api.sources;

import com.goldtracker.acquisition.Market;
import com.goldtracker.acquisition.SourceCatalog;
import com.goldtracker.api.FallbackChain;
import com.goldtracker.api.HistorySource;
import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.MergingSource;
import com.goldtracker.api.PriceSource;
import com.goldtracker.api.model.ExchangeRateTable;
import com.goldtracker.config.Config;
import com.goldtracker.metrics.MetricsService;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wires the concrete adapters into per-market composites.
 */
public final class MarketSources implements SourceCatalog {

    private final Config config;
    private final HttpFetcher fetcher;
    private final MetricsService metrics;

    private final FreeGoldApiSource freeGoldApi;
    private final TwelveDataSource twelveData;

    public MarketSources(Config config, HttpFetcher fetcher, MetricsService metrics) {
        this.config = config;
        this.fetcher = fetcher;
        this.metrics = metrics;
        this.freeGoldApi = new FreeGoldApiSource(fetcher);
        this.twelveData = new TwelveDataSource(fetcher, config.twelveDataApiKey());
    }

    @Override
    public ExchangeRateProvider exchangeRates() {
        return new ExchangeRateApiClient(fetcher);
    }

    @Override
    public PriceSource benchmark() {
        return new FallbackChain(Market.INTERNATIONAL.displayName(), List.of(
            freeGoldApi,
            new GoldApiIoSource(fetcher, config.goldApiKey()),
            twelveData), metrics);
    }

    /**
     * International history, free feed first.
     */
    public List<HistorySource> history() {
        return List.of(freeGoldApi, twelveData);
    }

    /**
     * Multi-year history. Only TwelveData serves more than the free feed's window.
     */
    public List<HistorySource> longHistory() {
        return List.of(twelveData);
    }

    public PriceSource vietnam() {
        return new MergingSource(Market.VIETNAM.displayName(), List.of(
            new GiaVangSource(fetcher),
            new GoldPriceOrgVietnamSource(fetcher),
            new GoldPricezSource(fetcher),
            new VnAppMobSource(fetcher, config.vnAppMobApiKey())), metrics);
    }

    @Override
    public Map<Market, PriceSource> dependentMarkets(double benchmarkUsdPerOunce, ExchangeRateTable rates) {
        var markets = new LinkedHashMap<Market, PriceSource>();
        markets.put(Market.VIETNAM, vietnam());
        markets.put(Market.CHINA, spotOrCalculated(Market.CHINA, benchmarkUsdPerOunce, rates));
        markets.put(Market.RUSSIA, spotOrCalculated(Market.RUSSIA, benchmarkUsdPerOunce, rates));
        markets.put(Market.INDIA, new MergingSource(Market.INDIA.displayName(), List.of(
            new MetalsDevSource(fetcher, config.metalsDevKey()),
            new IbjaSource(fetcher),
            new AllIndiaBullionSource(fetcher)), metrics));
        return markets;
    }

    private PriceSource spotOrCalculated(Market market, double benchmarkUsdPerOunce, ExchangeRateTable rates) {
        return new FallbackChain(market.displayName(), List.of(
            new GoldPriceOrgRatesSource(fetcher, market.displayName(), market.currency()),
            new CalculatedQuoteSource(market.displayName(), market.currency(), benchmarkUsdPerOunce, rates)),
            metrics);
    }
}

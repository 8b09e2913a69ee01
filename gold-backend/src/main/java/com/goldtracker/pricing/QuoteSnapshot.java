package com.goldtracker.pricing;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.goldtracker.api.model.ExchangeRateTable;
import com.goldtracker.api.model.RawQuote;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted result of one fetch cycle ({@code latest.json}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuoteSnapshot(
    Instant timestamp,
    List<NormalizedQuote> normalized,
    Map<String, List<RawQuote>> raw,
    ExchangeRateTable exchangeRates,
    PremiumResult vietnamPremium,
    List<String> warnings
) {

    public static final String FILE_NAME = "latest.json";
}

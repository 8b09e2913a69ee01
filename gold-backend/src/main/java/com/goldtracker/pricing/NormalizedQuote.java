package com.goldtracker.pricing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.goldtracker.config.GoldUnits;

import java.util.Objects;

/**
 * A quote in the canonical unit. The tael price is always derived from the gram price.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NormalizedQuote(
    String source,
    String country,
    String originalCurrency,
    double originalPricePerGram,
    double vndPerGram
) {

    public NormalizedQuote {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(country, "country");
        Objects.requireNonNull(originalCurrency, "originalCurrency");
    }

    @JsonProperty
    public double vndPerTael() {
        return GoldUnits.gramToTael(vndPerGram);
    }
}

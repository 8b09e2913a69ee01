package com.goldtracker.api.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.goldtracker.config.GoldUnits;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One trading day of the international price, in USD per ounce and in canonical VND units.
 * The VND per tael value is derived from VND per gram.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoricalPoint(LocalDate date, double usdPerOunce, double vndPerGram) {

    public HistoricalPoint {
        Objects.requireNonNull(date, "date");
    }

    /**
     * Convert a USD close into canonical units at the given USD/VND rate.
     */
    public static HistoricalPoint fromUsd(UsdPricePoint point, double usdVndRate) {
        double usdPerGram = GoldUnits.ounceToGram(point.usdPerOunce());
        return new HistoricalPoint(point.date(), point.usdPerOunce(), usdPerGram * usdVndRate);
    }

    @JsonProperty("usdPerGram")
    public double usdPerGram() {
        return GoldUnits.ounceToGram(usdPerOunce);
    }

    @JsonProperty("vndPerTael")
    public double vndPerTael() {
        return GoldUnits.gramToTael(vndPerGram);
    }
}

package com.goldtracker.config;

/**
 * Weight units used when converting between gold quotes.
 */
public final class GoldUnits {
    /** One Vietnamese tael (lượng) in grams. */
    public static final double TAEL_GRAMS = 37.5;

    /** One troy ounce in grams. */
    public static final double TROY_OUNCE_GRAMS = 31.1035;

    private GoldUnits() {}

    public static double ounceToGram(double pricePerOunce) {
        return pricePerOunce / TROY_OUNCE_GRAMS;
    }

    public static double gramToTael(double pricePerGram) {
        return pricePerGram * TAEL_GRAMS;
    }

    public static double taelToGram(double pricePerTael) {
        return pricePerTael / TAEL_GRAMS;
    }
}

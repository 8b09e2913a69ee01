package com.goldtracker.pricing;

/**
 * Local price against the benchmark, both in VND per tael.
 */
public record PremiumResult(double premiumPercent, double benchmarkVND, double localPriceVND) {
}

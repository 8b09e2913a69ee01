package com.goldtracker.api.model;

import java.time.LocalDate;

/**
 * One daily international close, USD per troy ounce.
 */
public record UsdPricePoint(LocalDate date, double usdPerOunce) {}

package com.goldtracker.history;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One day's Vietnam dealer prices next to the international price. {@code premium} is
 * the bar (Miếng) sell premium in percent, absent when there was no bar quote.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DailySnapshot(
    LocalDate date,
    Instant timestamp,
    DealerPrice sjcMieng,
    DealerPrice sjcNhan,
    InternationalPrice international,
    double exchangeRate,
    Double premium
) {

    public record DealerPrice(Double buy, double sell) {}

    public record InternationalPrice(double usdPerOunce, double vndPerTael) {}
}

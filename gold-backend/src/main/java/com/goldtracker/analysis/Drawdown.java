package com.goldtracker.analysis;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One peak to trough decline and, when it happened, the return to the peak level.
 * Day counts are calendar days from the peak.
 */
public record Drawdown(
    LocalDate peakDate,
    double peakPrice,
    LocalDate troughDate,
    double troughPrice,
    double drawdownPct,
    LocalDate recoveryDate,
    long daysToTrough,
    Long daysToRecovery,
    boolean recovered
) {

    public Drawdown {
        Objects.requireNonNull(peakDate, "peakDate");
        Objects.requireNonNull(troughDate, "troughDate");
        if (troughDate.isBefore(peakDate)) {
            throw new IllegalArgumentException("Trough " + troughDate + " before peak " + peakDate);
        }
        if (recovered != (recoveryDate != null) || recovered != (daysToRecovery != null)) {
            throw new IllegalArgumentException("Recovery fields inconsistent for peak " + peakDate);
        }
        if (recovered && !recoveryDate.isAfter(troughDate)) {
            throw new IllegalArgumentException("Recovery " + recoveryDate + " not after trough " + troughDate);
        }
    }
}

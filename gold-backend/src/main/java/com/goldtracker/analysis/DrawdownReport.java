package com.goldtracker.analysis;

import com.goldtracker.api.model.HistoricalSeries;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Persisted drawdown analysis ({@code drawdowns.json}). Events are ordered worst first.
 */
public record DrawdownReport(
    Instant analyzedAt,
    String dataFile,
    double minDrawdownPct,
    Period period,
    DrawdownSummary summary,
    List<Drawdown> drawdowns
) {

    public static final String FILE_NAME = "drawdowns.json";

    public record Period(LocalDate start, LocalDate end) {}

    public static DrawdownReport analyze(HistoricalSeries series, double minDrawdownPct, String dataFile) {
        var events = DrawdownDetector.detect(series, minDrawdownPct);
        var bySeverity = events.stream()
            .sorted(Comparator.comparingDouble(Drawdown::drawdownPct).reversed())
            .toList();
        return new DrawdownReport(
            Instant.now(),
            dataFile,
            minDrawdownPct,
            new Period(series.first().date(), series.last().date()),
            DrawdownSummary.of(events),
            bySeverity);
    }
}

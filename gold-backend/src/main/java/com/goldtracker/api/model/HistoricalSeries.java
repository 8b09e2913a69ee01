package com.goldtracker.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Chronological, gap-tolerant sequence of daily points. Dates are strictly ascending.
 */
public final class HistoricalSeries {

    private final List<HistoricalPoint> points;

    /**
     * @throws IllegalArgumentException if the points are not strictly ascending by date
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public HistoricalSeries(List<HistoricalPoint> points) {
        for (int i = 1; i < points.size(); i++) {
            var previous = points.get(i - 1).date();
            var current = points.get(i).date();
            if (!current.isAfter(previous)) {
                throw new IllegalArgumentException(
                    "Series must be strictly ascending by date: " + previous + " then " + current);
            }
        }
        this.points = List.copyOf(points);
    }

    /**
     * Sort arbitrary points by date; a later duplicate of a date replaces the earlier one.
     */
    public static HistoricalSeries of(Collection<HistoricalPoint> points) {
        var byDate = new LinkedHashMap<LocalDate, HistoricalPoint>();
        for (var point : points) {
            byDate.put(point.date(), point);
        }
        var sorted = new ArrayList<>(byDate.values());
        sorted.sort(Comparator.comparing(HistoricalPoint::date));
        return new HistoricalSeries(sorted);
    }

    @JsonValue
    public List<HistoricalPoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public HistoricalPoint get(int index) {
        return points.get(index);
    }

    public HistoricalPoint first() {
        requireNonEmpty();
        return points.get(0);
    }

    public HistoricalPoint last() {
        requireNonEmpty();
        return points.get(points.size() - 1);
    }

    public double[] values(ToDoubleFunction<HistoricalPoint> field) {
        return points.stream().mapToDouble(field).toArray();
    }

    private void requireNonEmpty() {
        if (points.isEmpty()) {
            throw new IllegalStateException("Historical series is empty");
        }
    }
}

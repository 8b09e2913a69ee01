package com.goldtracker.history;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The daily snapshot log ({@code vietnam-history.json}), one entry per date, oldest first.
 */
public record VietnamHistory(Instant lastUpdated, List<DailySnapshot> snapshots) {

    public static final String FILE_NAME = "vietnam-history.json";

    public VietnamHistory {
        snapshots = snapshots == null ? List.of() : List.copyOf(snapshots);
    }

    public static VietnamHistory empty() {
        return new VietnamHistory(null, List.of());
    }

    /**
     * Add a snapshot, replacing any existing entry for the same date.
     */
    public VietnamHistory with(DailySnapshot snapshot, Instant now) {
        var updated = new ArrayList<DailySnapshot>();
        for (DailySnapshot existing : snapshots) {
            if (!existing.date().equals(snapshot.date())) {
                updated.add(existing);
            }
        }
        updated.add(snapshot);
        updated.sort(Comparator.comparing(DailySnapshot::date));
        return new VietnamHistory(now, updated);
    }

    public boolean hasDate(LocalDate date) {
        return snapshots.stream().anyMatch(s -> s.date().equals(date));
    }
}

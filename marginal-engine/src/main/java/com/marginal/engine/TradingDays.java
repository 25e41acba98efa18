package com.marginal.engine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The run's trading calendar, used as the clock for holding periods and re-entry windows.
 */
public class TradingDays {

    private final List<LocalDate> dates;

    public TradingDays(List<LocalDate> dates) {
        this.dates = List.copyOf(dates);
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public int size() {
        return dates.size();
    }

    public boolean isEmpty() {
        return dates.isEmpty();
    }

    /**
     * Number of trading dates strictly after {@code from} up to and including {@code to}.
     */
    public int elapsed(LocalDate from, LocalDate to) {
        if (!to.isAfter(from)) {
            return 0;
        }
        return countUpTo(to) - countUpTo(from);
    }

    /**
     * The trading date following {@code date}, or empty on the last date of the run.
     */
    public Optional<LocalDate> next(LocalDate date) {
        int idx = countUpTo(date);
        return idx < dates.size() ? Optional.of(dates.get(idx)) : Optional.empty();
    }

    /**
     * Dates up to and including {@code date}, most recent first.
     */
    public List<LocalDate> backwardsFrom(LocalDate date) {
        List<LocalDate> head = new ArrayList<>(dates.subList(0, countUpTo(date)));
        Collections.reverse(head);
        return head;
    }

    // Count of calendar dates <= date
    private int countUpTo(LocalDate date) {
        int idx = Collections.binarySearch(dates, date);
        return idx >= 0 ? idx + 1 : -idx - 1;
    }
}

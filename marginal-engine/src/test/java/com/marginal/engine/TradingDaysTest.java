package com.marginal.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for calendar-based day counting.
 */
class TradingDaysTest {

    // Mon-Fri of two weeks, with Wednesday the 10th missing
    private final TradingDays days = new TradingDays(List.of(
        LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3),
        LocalDate.of(2024, 1, 4), LocalDate.of(2024, 1, 5),
        LocalDate.of(2024, 1, 8), LocalDate.of(2024, 1, 9),
        LocalDate.of(2024, 1, 11), LocalDate.of(2024, 1, 12)
    ));

    @Test
    @DisplayName("Elapsed counts calendar dates after the start up to and including the end")
    void elapsed() {
        assertEquals(0, days.elapsed(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 2)));
        assertEquals(1, days.elapsed(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3)));
        assertEquals(4, days.elapsed(LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 9)),
            "Weekend days are not trading days");
        assertEquals(3, days.elapsed(LocalDate.of(2024, 1, 8), LocalDate.of(2024, 1, 12)),
            "Missing date is skipped");
    }

    @Test
    @DisplayName("Elapsed works for dates outside the calendar")
    void elapsedOffCalendar() {
        assertEquals(1, days.elapsed(LocalDate.of(2024, 1, 6), LocalDate.of(2024, 1, 8)));
        assertEquals(0, days.elapsed(LocalDate.of(2024, 1, 9), LocalDate.of(2024, 1, 1)));
    }

    @Test
    @DisplayName("Next returns the following trading date, empty on the last")
    void next() {
        assertEquals(Optional.of(LocalDate.of(2024, 1, 8)), days.next(LocalDate.of(2024, 1, 5)));
        assertEquals(Optional.of(LocalDate.of(2024, 1, 11)), days.next(LocalDate.of(2024, 1, 9)));
        assertTrue(days.next(LocalDate.of(2024, 1, 12)).isEmpty());
    }

    @Test
    @DisplayName("Backwards lists dates on or before a date, most recent first")
    void backwards() {
        List<LocalDate> back = days.backwardsFrom(LocalDate.of(2024, 1, 3));
        assertEquals(List.of(LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 1)), back);
    }
}

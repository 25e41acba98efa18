package com.marginal.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BacktestConfig validation and defaults.
 */
class BacktestConfigTest {

    private static final LocalDate START = LocalDate.of(2020, 1, 1);
    private static final LocalDate END = LocalDate.of(2025, 11, 17);

    @Test
    @DisplayName("Defaults enable both exits with market entries and 1,000,000 capital")
    void defaults() {
        BacktestConfig config = BacktestConfig.defaults(START, END);

        assertEquals(1_000_000.0, config.initialCapital());
        assertTrue(config.enableTakeProfit());
        assertTrue(config.enableStopLoss());
        assertEquals(EntryMode.MARKET_AT_OPEN, config.entryMode());
    }

    @Test
    @DisplayName("Rejects non-positive capital")
    void rejectsNonPositiveCapital() {
        assertThrows(IllegalArgumentException.class,
            () -> new BacktestConfig(START, END, 0, true, true, EntryMode.MARKET_AT_OPEN));
        assertThrows(IllegalArgumentException.class,
            () -> BacktestConfig.defaults(START, END).withInitialCapital(-1));
    }

    @Test
    @DisplayName("Rejects a start date after the end date")
    void rejectsInvertedWindow() {
        assertThrows(IllegalArgumentException.class, () -> BacktestConfig.defaults(END, START));
    }

    @Test
    @DisplayName("Rejects missing dates")
    void rejectsMissingDates() {
        assertThrows(IllegalArgumentException.class, () -> BacktestConfig.defaults(null, END));
    }

    @Test
    @DisplayName("Null entry mode falls back to market at open")
    void nullEntryMode() {
        BacktestConfig config = new BacktestConfig(START, END, 500_000, false, true, null);
        assertEquals(EntryMode.MARKET_AT_OPEN, config.entryMode());
    }

    @Test
    @DisplayName("Entry mode parses its short names")
    void entryModeParsing() {
        assertEquals(EntryMode.LIMIT_AT_SIGNAL_OPEN, EntryMode.fromValue("limit"));
        assertEquals(EntryMode.MARKET_AT_OPEN, EntryMode.fromValue("MARKET"));
        assertThrows(IllegalArgumentException.class, () -> EntryMode.fromValue("stop"));
    }
}

package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * Configuration for a backtest run
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestConfig(
    LocalDate startDate,
    LocalDate endDate,
    double initialCapital,
    boolean enableTakeProfit,
    boolean enableStopLoss,
    EntryMode entryMode
) {
    public BacktestConfig {
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate " + startDate + " is after endDate " + endDate);
        }
        if (!(initialCapital > 0)) {
            throw new IllegalArgumentException("initialCapital must be > 0: " + initialCapital);
        }
        if (entryMode == null) {
            entryMode = EntryMode.MARKET_AT_OPEN;
        }
    }

    /**
     * Create default config
     */
    public static BacktestConfig defaults(LocalDate startDate, LocalDate endDate) {
        return new BacktestConfig(startDate, endDate, 1_000_000, true, true, EntryMode.MARKET_AT_OPEN);
    }

    public BacktestConfig withInitialCapital(double capital) {
        return new BacktestConfig(startDate, endDate, capital, enableTakeProfit, enableStopLoss, entryMode);
    }

    public BacktestConfig withExits(boolean takeProfit, boolean stopLoss) {
        return new BacktestConfig(startDate, endDate, initialCapital, takeProfit, stopLoss, entryMode);
    }

    public BacktestConfig withEntryMode(EntryMode mode) {
        return new BacktestConfig(startDate, endDate, initialCapital, enableTakeProfit, enableStopLoss, mode);
    }
}

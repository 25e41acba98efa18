package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * One instrument's daily signal fields, as produced by the upstream
 * margin analytics pipeline. Read-only input to the scanner.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SignalRow(
    String ticker,
    String name,                   // Display name, falls back to ticker
    LocalDate date,
    double ratio,                  // Margin maintenance ratio
    double avg10Ratio,             // 10-day moving average of ratio
    double volume,
    double avg10Volume,
    double open,
    double close,
    double balanceShares,          // Outstanding margin balance in shares
    double avg5BalanceThreshold    // 95% of the 5-day average balance
) {
    public SignalRow {
        if (name == null || name.isBlank()) {
            name = ticker;
        }
    }

    /**
     * Relative drop of ratio below its 10-day average, in percent (negative when below).
     */
    public double dropPct() {
        return (ratio - avg10Ratio) / avg10Ratio * 100;
    }

    public boolean isBullishBar() {
        return close > open;
    }
}

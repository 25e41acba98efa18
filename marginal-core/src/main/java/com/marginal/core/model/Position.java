package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * An open long position in one instrument.
 * Immutable; a re-entry produces a new merged instance.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Position(
    String ticker,
    String name,
    long shares,
    double weightedCost,       // Share-weighted average of all open buy tranches
    LocalDate entryDate,       // Date of the most recent fill
    LocalDate entrySignalDate  // Signal date of the most recent fill
) {
    public static Position open(String ticker, String name, long shares, double price,
                                LocalDate entryDate, LocalDate signalDate) {
        return new Position(ticker, name, shares, price, entryDate, signalDate);
    }

    /**
     * Add a tranche, re-averaging the cost basis and moving both entry dates forward.
     */
    public Position merge(long addedShares, double price, LocalDate entryDate, LocalDate signalDate) {
        long total = shares + addedShares;
        double cost = (weightedCost * shares + price * addedShares) / total;
        return new Position(ticker, name, total, cost, entryDate, signalDate);
    }

    public double costBasis() {
        return weightedCost * shares;
    }

    public double returnAt(double price) {
        return (price - weightedCost) / weightedCost;
    }

    public double marketValue(double price) {
        return shares * price;
    }
}

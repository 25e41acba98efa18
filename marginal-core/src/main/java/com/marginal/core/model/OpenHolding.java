package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * A position still open when the run ended, valued at its last available close.
 * lastClose and lastCloseDate are null when no close exists anywhere in the window.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OpenHolding(
    String ticker,
    String name,
    long shares,
    double weightedCost,
    LocalDate entryDate,
    Double lastClose,
    LocalDate lastCloseDate,
    double marketValue
) {
    public static OpenHolding of(Position position, Double lastClose, LocalDate lastCloseDate) {
        double value = lastClose != null ? position.marketValue(lastClose) : 0;
        return new OpenHolding(position.ticker(), position.name(), position.shares(),
            position.weightedCost(), position.entryDate(), lastClose, lastCloseDate, value);
    }
}

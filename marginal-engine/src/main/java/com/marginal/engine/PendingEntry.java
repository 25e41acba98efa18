package com.marginal.engine;

import com.marginal.core.model.PriceBar;

import java.time.LocalDate;

/**
 * A limit buy placed on signal day at the signal day's open, live only on the
 * following trading day. Fills at the limit price when that day's low reaches it.
 */
public record PendingEntry(
    String ticker,
    String name,
    double limitPrice,
    long shares,
    boolean oddLot,
    LocalDate signalDate,
    LocalDate executionDate
) {
    public boolean isFilledBy(PriceBar bar) {
        return bar.low() <= limitPrice;
    }

    /**
     * Orders are good for their execution date only.
     */
    public boolean isExpired(LocalDate date) {
        return date.isAfter(executionDate);
    }
}

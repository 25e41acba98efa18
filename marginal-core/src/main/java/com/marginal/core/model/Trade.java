package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * Append-only ledger entry for a single fill.
 * Sell-only fields (entryPrice, pnl, pnlPct, reason, holdingDays) are null on buys,
 * and signalDate is null on sells.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Trade(
    LocalDate date,
    TradeAction action,
    String ticker,
    String name,
    long shares,
    double price,
    double value,          // shares * price
    double commission,
    double tax,
    double netAmount,      // Total cost on a buy, net proceeds on a sell
    boolean oddLot,
    LocalDate signalDate,
    Double entryPrice,     // Weighted cost of the position sold
    Double pnl,
    Double pnlPct,         // pnl over cost basis, in percent
    ExitReason reason,
    Integer holdingDays
) {
    /**
     * Create a buy fill.
     */
    public static Trade buy(LocalDate date, String ticker, String name, long shares, double price,
                            double commission, boolean oddLot, LocalDate signalDate) {
        double value = shares * price;
        return new Trade(date, TradeAction.BUY, ticker, name, shares, price, value,
            commission, 0, value + commission, oddLot, signalDate,
            null, null, null, null, null);
    }

    /**
     * Create a full-position sell fill. Pnl is measured against the position's cost basis.
     */
    public static Trade sell(LocalDate date, Position position, double price, double commission,
                             double tax, boolean oddLot, ExitReason reason, int holdingDays) {
        long shares = position.shares();
        double value = shares * price;
        double netProceeds = value - commission - tax;
        double costBasis = position.costBasis();
        double pnl = netProceeds - costBasis;
        double pnlPct = costBasis > 0 ? pnl / costBasis * 100 : 0;
        return new Trade(date, TradeAction.SELL, position.ticker(), position.name(), shares, price, value,
            commission, tax, netProceeds, oddLot, null,
            position.weightedCost(), pnl, pnlPct, reason, holdingDays);
    }

    @JsonIgnore
    public boolean isBuy() {
        return action == TradeAction.BUY;
    }

    @JsonIgnore
    public boolean isSell() {
        return action == TradeAction.SELL;
    }

    @JsonIgnore
    public boolean isWinner() {
        return pnl != null && pnl > 0;
    }
}

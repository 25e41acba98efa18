package com.marginal.engine;

/**
 * Shares and cost for a buy, before the cash check.
 *
 * @param shares     whole shares to buy, possibly zero
 * @param oddLot     true when fewer than one board lot
 * @param value      shares * price
 * @param commission commission for the lot type
 */
public record OrderSizing(long shares, boolean oddLot, double value, double commission) {

    public double totalCost() {
        return value + commission;
    }

    /**
     * Size a buy at a fixed fraction of cash. Quantities of at least one board lot
     * round down to whole lots; smaller quantities trade as an odd lot.
     */
    public static OrderSizing of(double cash, double price, double sizeRatio, int boardLot, CostModel costs) {
        long raw = (long) Math.floor(cash * sizeRatio / price);
        boolean oddLot = raw < boardLot;
        long shares = oddLot ? raw : (raw / boardLot) * boardLot;
        return forShares(shares, oddLot, price, costs);
    }

    public static OrderSizing forShares(long shares, boolean oddLot, double price, CostModel costs) {
        double value = shares * price;
        return new OrderSizing(shares, oddLot, value, costs.commission(value, oddLot));
    }
}

package com.marginal.engine;

/**
 * Brokerage commission and securities transaction tax.
 */
public class CostModel {

    public static final double COMMISSION_RATE = 0.001425;
    public static final double MIN_COMMISSION_ROUND_LOT = 20;
    public static final double MIN_COMMISSION_ODD_LOT = 1;
    public static final double TAX_RATE = 0.003;
    public static final double DAY_TRADE_TAX_RATE = 0.0015;

    private final double commissionRate;
    private final double minRoundLot;
    private final double minOddLot;
    private final double taxRate;
    private final double dayTradeTaxRate;

    public CostModel() {
        this(COMMISSION_RATE, MIN_COMMISSION_ROUND_LOT, MIN_COMMISSION_ODD_LOT, TAX_RATE, DAY_TRADE_TAX_RATE);
    }

    public CostModel(double commissionRate, double minRoundLot, double minOddLot,
                     double taxRate, double dayTradeTaxRate) {
        this.commissionRate = commissionRate;
        this.minRoundLot = minRoundLot;
        this.minOddLot = minOddLot;
        this.taxRate = taxRate;
        this.dayTradeTaxRate = dayTradeTaxRate;
    }

    /**
     * Commission on a buy or sell, subject to the per-order minimum for the lot type.
     */
    public double commission(double value, boolean oddLot) {
        return Math.max(value * commissionRate, oddLot ? minOddLot : minRoundLot);
    }

    /**
     * Transaction tax, charged on sells only. Positions bought and sold on the
     * same date pay the reduced day-trade rate.
     */
    public double tax(double value, boolean sameDay) {
        return value * (sameDay ? dayTradeTaxRate : taxRate);
    }
}

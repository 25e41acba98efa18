package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Performance metrics calculated from the trade ledger and daily snapshots.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerformanceMetrics(
    int buyCount,
    int sellCount,
    double finalCash,
    double finalValue,
    double totalReturn,         // Fraction of initial capital
    double totalReturnPercent,
    double totalPnl,            // Realized, over sells
    double averagePnlPercent,
    double winRate,             // Fraction of sells with pnl > 0
    double averageWin,
    double averageLoss,         // Mean pnl of sells with pnl <= 0
    double sharpeRatio,
    double maxDrawdown,         // Non-positive fraction
    Map<ExitReason, ReasonStats> exitReasons
) {
    public static final int TRADING_DAYS_PER_YEAR = 252;

    /**
     * Sell count and mean pnl percent for one exit reason.
     */
    public record ReasonStats(int count, double averagePnlPercent) {}

    /**
     * Create empty metrics (no snapshots)
     */
    public static PerformanceMetrics empty(double initialCapital) {
        return new PerformanceMetrics(0, 0, initialCapital, initialCapital, 0, 0,
            0, 0, 0, 0, 0, 0, 0, Collections.emptyMap());
    }

    /**
     * Calculate metrics from the ledger and the snapshot sequence.
     */
    public static PerformanceMetrics calculate(List<Trade> trades, List<PortfolioSnapshot> snapshots,
                                               double initialCapital) {
        if (snapshots == null || snapshots.isEmpty()) {
            return empty(initialCapital);
        }

        int buys = 0;
        int sells = 0;
        int winners = 0;
        int losers = 0;
        double totalPnl = 0;
        double totalPnlPct = 0;
        double totalWins = 0;
        double totalLosses = 0;
        Map<ExitReason, double[]> byReason = new EnumMap<>(ExitReason.class);

        for (Trade t : trades) {
            if (t.isBuy()) {
                buys++;
                continue;
            }
            sells++;
            double pnl = t.pnl() != null ? t.pnl() : 0;
            double pnlPct = t.pnlPct() != null ? t.pnlPct() : 0;
            totalPnl += pnl;
            totalPnlPct += pnlPct;
            if (pnl > 0) {
                winners++;
                totalWins += pnl;
            } else {
                losers++;
                totalLosses += pnl;
            }
            if (t.reason() != null) {
                double[] acc = byReason.computeIfAbsent(t.reason(), r -> new double[2]);
                acc[0]++;
                acc[1] += pnlPct;
            }
        }

        Map<ExitReason, ReasonStats> reasons = new EnumMap<>(ExitReason.class);
        byReason.forEach((reason, acc) ->
            reasons.put(reason, new ReasonStats((int) acc[0], acc[1] / acc[0])));

        PortfolioSnapshot last = snapshots.get(snapshots.size() - 1);
        double finalValue = last.portfolioValue();
        double totalReturn = (finalValue - initialCapital) / initialCapital;

        return new PerformanceMetrics(
            buys, sells, last.cash(), finalValue, totalReturn, totalReturn * 100,
            totalPnl,
            sells > 0 ? totalPnlPct / sells : 0,
            sells > 0 ? (double) winners / sells : 0,
            winners > 0 ? totalWins / winners : 0,
            losers > 0 ? totalLosses / losers : 0,
            sharpeRatio(snapshots),
            maxDrawdown(snapshots),
            Collections.unmodifiableMap(reasons)
        );
    }

    /**
     * Annualized Sharpe over day-over-day value changes, using the sample standard deviation.
     * Zero when there are fewer than two returns or no variation.
     */
    static double sharpeRatio(List<PortfolioSnapshot> snapshots) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < snapshots.size(); i++) {
            double prev = snapshots.get(i - 1).portfolioValue();
            if (prev > 0) {
                returns.add(snapshots.get(i).portfolioValue() / prev - 1);
            }
        }
        if (returns.size() < 2) {
            return 0;
        }

        double mean = returns.stream().mapToDouble(d -> d).average().orElse(0);
        double sumSq = returns.stream().mapToDouble(d -> Math.pow(d - mean, 2)).sum();
        double stdDev = Math.sqrt(sumSq / (returns.size() - 1));
        if (stdDev <= 0) {
            return 0;
        }
        return (mean / stdDev) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    /**
     * Deepest peak-to-trough decline, as a non-positive fraction of the running peak.
     */
    static double maxDrawdown(List<PortfolioSnapshot> snapshots) {
        double peak = Double.NEGATIVE_INFINITY;
        double worst = 0;
        for (PortfolioSnapshot s : snapshots) {
            double value = s.portfolioValue();
            peak = Math.max(peak, value);
            if (peak > 0) {
                worst = Math.min(worst, (value - peak) / peak);
            }
        }
        return worst;
    }
}

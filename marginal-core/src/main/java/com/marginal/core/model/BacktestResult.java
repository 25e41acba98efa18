package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Result of a backtest run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestResult(
    BacktestConfig config,
    StrategyRules rules,
    List<Trade> trades,
    List<PortfolioSnapshot> snapshots,
    List<OpenHolding> openHoldings,
    List<OrderRejection> rejections,
    PerformanceMetrics metrics,
    int tradingDays,
    long duration          // Wall-clock run time in ms
) {
    /**
     * Final portfolio value: the last snapshot's value, or the initial capital when nothing ran.
     */
    public double finalValue() {
        return metrics.finalValue();
    }

    public double totalReturn() {
        return metrics.totalReturn();
    }

    public boolean hasTrades() {
        return trades != null && !trades.isEmpty();
    }
}

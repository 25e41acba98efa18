package com.marginal.runner;

import com.marginal.core.model.BacktestConfig;
import com.marginal.core.model.BacktestResult;
import com.marginal.core.model.ExitReason;
import com.marginal.core.model.OpenHolding;
import com.marginal.core.model.PerformanceMetrics;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text summary of a finished run, one log line per row.
 */
public class ConsoleReport {

    private static final String RULE = "=".repeat(60);
    private static final String THIN_RULE = "-".repeat(60);

    private final BacktestResult result;

    public ConsoleReport(BacktestResult result) {
        this.result = result;
    }

    public List<String> lines() {
        List<String> out = new ArrayList<>();
        BacktestConfig config = result.config();
        PerformanceMetrics m = result.metrics();

        out.add(RULE);
        out.add("Margin ratio backtest");
        out.add(RULE);
        out.add(fmt("Window:            %s to %s (%d trading days)",
            config.startDate(), config.endDate(), result.tradingDays()));
        out.add(fmt("Initial capital:   %,.0f", config.initialCapital()));
        out.add(fmt("Entry mode:        %s", config.entryMode().getValue()));
        out.add(fmt("Take profit:       %s", onOff(config.enableTakeProfit())));
        out.add(fmt("Stop loss:         %s", onOff(config.enableStopLoss())));

        out.add(THIN_RULE);
        out.add(fmt("Final cash:        %,.0f", m.finalCash()));
        out.add(fmt("Final value:       %,.0f", m.finalValue()));
        out.add(fmt("Total return:      %+.2f%%", m.totalReturnPercent()));
        out.add(fmt("Buys / sells:      %d / %d", m.buyCount(), m.sellCount()));
        out.add(fmt("Rejected orders:   %d", result.rejections().size()));

        if (m.sellCount() > 0) {
            out.add(THIN_RULE);
            out.add(fmt("Realized pnl:      %,.0f", m.totalPnl()));
            out.add(fmt("Average pnl:       %+.2f%%", m.averagePnlPercent()));
            out.add(fmt("Win rate:          %.2f%%", m.winRate() * 100));
            out.add(fmt("Average win:       %,.0f", m.averageWin()));
            out.add(fmt("Average loss:      %,.0f", m.averageLoss()));

            out.add("Exit reasons:");
            for (Map.Entry<ExitReason, PerformanceMetrics.ReasonStats> e : m.exitReasons().entrySet()) {
                out.add(fmt("  %-16s %5d  avg %+.2f%%",
                    e.getKey().getValue(), e.getValue().count(), e.getValue().averagePnlPercent()));
            }
        }

        out.add(THIN_RULE);
        out.add(fmt("Sharpe ratio:      %.2f", m.sharpeRatio()));
        out.add(fmt("Max drawdown:      %.2f%%", m.maxDrawdown() * 100));

        List<OpenHolding> holdings = result.openHoldings();
        if (!holdings.isEmpty()) {
            out.add(THIN_RULE);
            out.add(fmt("Open holdings (%d):", holdings.size()));
            for (OpenHolding h : holdings) {
                String close = h.lastClose() != null
                    ? fmt("%.2f on %s", h.lastClose(), h.lastCloseDate())
                    : "no close";
                out.add(fmt("  %-8s %-12s %,8d sh  cost %.2f  last %s  value %,.0f",
                    h.ticker(), h.name(), h.shares(), h.weightedCost(), close, h.marketValue()));
            }
        }

        out.add(RULE);
        return out;
    }

    public void print(Logger logger) {
        lines().forEach(logger::info);
    }

    private static String onOff(boolean enabled) {
        return enabled ? "on" : "off";
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }
}

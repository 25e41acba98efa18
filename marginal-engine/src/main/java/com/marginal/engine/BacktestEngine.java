package com.marginal.engine;

import com.marginal.core.model.BacktestConfig;
import com.marginal.core.model.BacktestResult;
import com.marginal.core.model.Candidate;
import com.marginal.core.model.OpenHolding;
import com.marginal.core.model.OrderRejection;
import com.marginal.core.model.PerformanceMetrics;
import com.marginal.core.model.PortfolioSnapshot;
import com.marginal.core.model.StrategyRules;
import com.marginal.core.model.Trade;
import com.marginal.core.source.PriceRepository;
import com.marginal.core.source.SignalRepository;
import com.marginal.core.source.TradingCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Day-by-day backtest of the margin-ratio strategy.
 *
 * Each trading day runs, in order: entries scheduled from the previous day's signals,
 * stop-loss checks on the intraday low, rule-based exits on the close, valuation,
 * and finally the scan of today's signals for tomorrow's entries. The engine is
 * data-source agnostic; all market data comes through the three ports.
 */
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    static final int PROGRESS_INTERVAL = 100;

    private final TradingCalendar calendar;
    private final SignalRepository signals;
    private final PriceRepository prices;
    private final StrategyRules rules;
    private final CostModel costs;
    private final SignalScanner scanner;

    public BacktestEngine(TradingCalendar calendar, SignalRepository signals, PriceRepository prices) {
        this(calendar, signals, prices, StrategyRules.standard(), new CostModel());
    }

    public BacktestEngine(TradingCalendar calendar, SignalRepository signals, PriceRepository prices,
                          StrategyRules rules, CostModel costs) {
        this.calendar = calendar;
        this.signals = signals;
        this.prices = prices;
        this.rules = rules;
        this.costs = costs;
        this.scanner = new SignalScanner(rules);
    }

    public BacktestResult run(BacktestConfig config) {
        return run(config, null);
    }

    /**
     * Run a backtest over the configured window.
     *
     * @param config     window, capital, exit toggles and entry mode
     * @param onProgress optional progress callback, invoked every {@value #PROGRESS_INTERVAL} days and at the end
     * @return trades, daily snapshots, open holdings and metrics; an empty calendar yields
     *         no trades and a final value equal to the initial capital
     */
    public BacktestResult run(BacktestConfig config, Consumer<Progress> onProgress) {
        long startTime = System.currentTimeMillis();
        TradingDays days = new TradingDays(calendar.tradingDates(config.startDate(), config.endDate()));

        log.info("Backtest {} to {}: {} trading days, capital {}, take-profit {}, stop-loss {}, entries {}",
            config.startDate(), config.endDate(), days.size(), config.initialCapital(),
            config.enableTakeProfit() ? "on" : "off", config.enableStopLoss() ? "on" : "off",
            config.entryMode().getValue());

        if (days.isEmpty()) {
            log.warn("No trading dates between {} and {}", config.startDate(), config.endDate());
            return new BacktestResult(config, rules, List.of(), List.of(), List.of(), List.of(),
                PerformanceMetrics.empty(config.initialCapital()), 0, System.currentTimeMillis() - startTime);
        }

        OrderExecutor executor = new OrderExecutor(costs, rules, config.enableStopLoss(), days);
        EntryPlanner entries = new EntryPlanner(config.entryMode(), rules, prices, executor, days);
        StopLossMonitor stopLoss = new StopLossMonitor(prices, executor);
        ExitEvaluator exits = new ExitEvaluator(rules, config.enableTakeProfit(), config.enableStopLoss(), days);
        PortfolioValuator valuator = new PortfolioValuator(prices);

        EngineState state = EngineState.initial(config.initialCapital());
        List<Trade> trades = new ArrayList<>();
        List<OrderRejection> rejections = new ArrayList<>();
        List<PortfolioSnapshot> snapshots = new ArrayList<>(days.size());

        int total = days.size();
        for (int i = 0; i < total; i++) {
            LocalDate date = days.dates().get(i);

            StepResult day = entries.execute(state, date);
            if (config.enableStopLoss()) {
                day = day.then(s -> stopLoss.check(s, date));
            }
            day = day.then(s -> exits.exitPositions(s, date, prices, executor));

            snapshots.add(valuator.snapshot(day.state(), date));

            List<Candidate> candidates = i < total - 1 ? scanner.scan(signals.signalsOn(date)) : List.of();
            day = day.then(s -> entries.schedule(s, candidates, date));

            trades.addAll(day.trades());
            rejections.addAll(day.rejections());
            state = day.state();

            if ((i + 1) % PROGRESS_INTERVAL == 0) {
                int pct = (i + 1) * 100 / total;
                log.info("Progress: {}/{} ({}%)", i + 1, total, pct);
                if (onProgress != null) {
                    onProgress.accept(new Progress(i + 1, total, pct, "Simulating " + date));
                }
            }
        }

        LocalDate lastDate = days.dates().get(total - 1);
        List<OpenHolding> holdings = valuator.openHoldings(state.ledger(), days, lastDate);
        if (!holdings.isEmpty()) {
            log.info("{} positions still open at {}, kept at market value", holdings.size(), lastDate);
        }

        PerformanceMetrics metrics = PerformanceMetrics.calculate(trades, snapshots, config.initialCapital());
        long duration = System.currentTimeMillis() - startTime;
        log.info("Backtest complete in {} ms: {} trades, final value {}", duration, trades.size(), metrics.finalValue());

        if (onProgress != null) {
            onProgress.accept(new Progress(total, total, 100, "Complete"));
        }

        return new BacktestResult(config, rules, List.copyOf(trades), List.copyOf(snapshots), holdings,
            List.copyOf(rejections), metrics, total, duration);
    }

    /**
     * Progress update for callbacks
     */
    public record Progress(int current, int total, int percentage, String message) {}
}

package com.marginal.engine;

import com.marginal.core.model.ExitReason;
import com.marginal.core.model.Position;
import com.marginal.core.model.StrategyRules;
import com.marginal.core.source.PriceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Rule-based exits on the day's close: take-profit, close-based stop-loss, then holding period.
 */
public class ExitEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExitEvaluator.class);

    private final StrategyRules rules;
    private final boolean takeProfitEnabled;
    private final boolean stopLossEnabled;
    private final TradingDays days;

    public ExitEvaluator(StrategyRules rules, boolean takeProfitEnabled, boolean stopLossEnabled, TradingDays days) {
        this.rules = rules;
        this.takeProfitEnabled = takeProfitEnabled;
        this.stopLossEnabled = stopLossEnabled;
        this.days = days;
    }

    /**
     * The first exit rule the position meets at {@code close} on {@code date}, if any.
     */
    public Optional<ExitReason> evaluate(Position position, double close, LocalDate date) {
        double returnPct = position.returnAt(close);
        if (takeProfitEnabled && returnPct >= rules.takeProfit()) {
            return Optional.of(ExitReason.TAKE_PROFIT);
        }
        if (stopLossEnabled && returnPct <= -rules.stopLoss()) {
            return Optional.of(ExitReason.STOP_LOSS);
        }
        if (days.elapsed(position.entryDate(), date) >= rules.holdingPeriod()) {
            return Optional.of(ExitReason.HOLDING_PERIOD);
        }
        return Optional.empty();
    }

    /**
     * Evaluate every open position and sell those that exit at the day's close.
     * Positions without a close for the date are left alone.
     */
    public StepResult exitPositions(EngineState state, LocalDate date, PriceRepository prices, OrderExecutor executor) {
        record Exit(String ticker, double price, ExitReason reason) {}

        List<Exit> exits = new ArrayList<>();
        for (Position position : state.ledger().positions()) {
            OptionalDouble close = prices.findClose(position.ticker(), date);
            if (close.isEmpty()) {
                log.debug("No close for {} on {}, exit rules skipped", position.ticker(), date);
                continue;
            }
            evaluate(position, close.getAsDouble(), date)
                .ifPresent(reason -> exits.add(new Exit(position.ticker(), close.getAsDouble(), reason)));
        }

        StepResult result = StepResult.of(state);
        for (Exit exit : exits) {
            result = result.then(s -> executor.sell(s, date, exit.ticker(), exit.price(), exit.reason()));
        }
        return result;
    }
}

package com.marginal.engine;

import com.marginal.core.model.ExitReason;
import com.marginal.core.model.OrderRejection;
import com.marginal.core.model.Position;
import com.marginal.core.model.StopLossOrder;
import com.marginal.core.model.StrategyRules;
import com.marginal.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;

/**
 * Executes buys and full-position sells against an engine state.
 * Every method is a pure transition: the input state is never modified.
 */
public class OrderExecutor {

    private static final Logger log = LoggerFactory.getLogger(OrderExecutor.class);

    private final CostModel costs;
    private final StrategyRules rules;
    private final boolean stopLossEnabled;
    private final TradingDays days;

    public OrderExecutor(CostModel costs, StrategyRules rules, boolean stopLossEnabled, TradingDays days) {
        this.costs = costs;
        this.rules = rules;
        this.stopLossEnabled = stopLossEnabled;
        this.days = days;
    }

    /**
     * Size a buy at the configured fraction of current cash.
     */
    public OrderSizing size(double cash, double price) {
        return OrderSizing.of(cash, price, rules.positionSizeRatio(), rules.boardLot(), costs);
    }

    /**
     * Buy at {@code price}, sized from current cash.
     * Rejected without any state change when sizing yields no shares or cash is short.
     */
    public StepResult buy(EngineState state, LocalDate date, String ticker, String name,
                          double price, LocalDate signalDate) {
        OrderSizing sizing = size(state.cash(), price);
        if (sizing.shares() <= 0) {
            log.debug("Buy rejected: {} on {} sizes to zero shares at {}", ticker, date, price);
            return StepResult.rejected(state, new OrderRejection(ticker, date, OrderRejection.Reason.NO_SHARES));
        }
        return fill(state, date, ticker, name, price, sizing, signalDate);
    }

    /**
     * Buy a pre-sized quantity at {@code price}; commission and cash are re-checked at fill time.
     */
    public StepResult buyShares(EngineState state, LocalDate date, String ticker, String name,
                                double price, long shares, boolean oddLot, LocalDate signalDate) {
        return fill(state, date, ticker, name, price, OrderSizing.forShares(shares, oddLot, price, costs), signalDate);
    }

    private StepResult fill(EngineState state, LocalDate date, String ticker, String name,
                            double price, OrderSizing sizing, LocalDate signalDate) {
        double totalCost = sizing.totalCost();
        if (totalCost > state.cash()) {
            log.debug("Buy rejected: {} on {} costs {} with {} cash", ticker, date, totalCost, state.cash());
            return StepResult.rejected(state, new OrderRejection(ticker, date, OrderRejection.Reason.INSUFFICIENT_CASH));
        }

        Position position = state.ledger().get(ticker)
            .map(existing -> existing.merge(sizing.shares(), price, date, signalDate))
            .orElseGet(() -> Position.open(ticker, name, sizing.shares(), price, date, signalDate));

        EngineState next = state.withPosition(position, state.cash() - totalCost);
        if (stopLossEnabled) {
            next = next.withStop(StopLossOrder.forPosition(position, rules.stopLoss()));
        }

        Trade trade = Trade.buy(date, ticker, name, sizing.shares(), price,
            sizing.commission(), sizing.oddLot(), signalDate);
        log.debug("Bought {} {} @ {} ({}), position {} @ {}",
            sizing.shares(), ticker, price, sizing.oddLot() ? "odd lot" : "round lot",
            position.shares(), position.weightedCost());
        return StepResult.traded(next, trade);
    }

    /**
     * Sell the whole position at {@code price}. No-op when nothing is held.
     */
    public StepResult sell(EngineState state, LocalDate date, String ticker, double price, ExitReason reason) {
        Position position = state.ledger().get(ticker).orElse(null);
        if (position == null) {
            return StepResult.of(state);
        }

        double value = position.shares() * price;
        boolean oddLot = position.shares() < rules.boardLot();
        double commission = costs.commission(value, oddLot);
        double tax = costs.tax(value, position.entryDate().equals(date));

        Trade trade = Trade.sell(date, position, price, commission, tax, oddLot, reason,
            days.elapsed(position.entryDate(), date));
        log.debug("Sold {} {} @ {} ({}), pnl {}", position.shares(), ticker, price, reason, trade.pnl());
        return StepResult.traded(state.withoutPosition(ticker, state.cash() + trade.netAmount()), trade);
    }
}

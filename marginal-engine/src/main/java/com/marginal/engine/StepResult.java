package com.marginal.engine;

import com.marginal.core.model.OrderRejection;
import com.marginal.core.model.Trade;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Outcome of one state transition: the new state plus the trades and rejections it emitted.
 */
public record StepResult(EngineState state, List<Trade> trades, List<OrderRejection> rejections) {

    public StepResult {
        trades = List.copyOf(trades);
        rejections = List.copyOf(rejections);
    }

    public static StepResult of(EngineState state) {
        return new StepResult(state, List.of(), List.of());
    }

    public static StepResult traded(EngineState state, Trade trade) {
        return new StepResult(state, List.of(trade), List.of());
    }

    public static StepResult rejected(EngineState state, OrderRejection rejection) {
        return new StepResult(state, List.of(), List.of(rejection));
    }

    /**
     * Run the next transition on this result's state, accumulating its events after ours.
     */
    public StepResult then(Function<EngineState, StepResult> step) {
        StepResult next = step.apply(state);
        if (next.trades.isEmpty() && next.rejections.isEmpty()) {
            return new StepResult(next.state, trades, rejections);
        }
        List<Trade> allTrades = new ArrayList<>(trades);
        allTrades.addAll(next.trades);
        List<OrderRejection> allRejections = new ArrayList<>(rejections);
        allRejections.addAll(next.rejections);
        return new StepResult(next.state, allTrades, allRejections);
    }
}

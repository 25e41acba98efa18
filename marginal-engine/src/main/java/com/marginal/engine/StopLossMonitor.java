package com.marginal.engine;

import com.marginal.core.model.ExitReason;
import com.marginal.core.model.PriceBar;
import com.marginal.core.model.StopLossOrder;
import com.marginal.core.source.PriceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks standing stop-loss orders against the day's intraday low.
 * A triggered stop sells the full position at the trigger price, not at the low.
 */
public class StopLossMonitor {

    private static final Logger log = LoggerFactory.getLogger(StopLossMonitor.class);

    private final PriceRepository prices;
    private final OrderExecutor executor;

    public StopLossMonitor(PriceRepository prices, OrderExecutor executor) {
        this.prices = prices;
        this.executor = executor;
    }

    public StepResult check(EngineState state, LocalDate date) {
        if (state.stopOrders().isEmpty()) {
            return StepResult.of(state);
        }

        EngineState current = state;
        List<StopLossOrder> triggered = new ArrayList<>();
        for (StopLossOrder stop : state.stopOrders().values()) {
            if (!state.ledger().contains(stop.ticker())) {
                current = current.withoutStop(stop.ticker());
                continue;
            }
            Optional<PriceBar> bar = prices.findBar(stop.ticker(), date);
            if (bar.isEmpty()) {
                log.debug("No bar for {} on {}, stop not checked", stop.ticker(), date);
                continue;
            }
            if (stop.isTriggeredBy(bar.get().low())) {
                triggered.add(stop);
            }
        }

        StepResult result = StepResult.of(current);
        for (StopLossOrder stop : triggered) {
            log.debug("Stop triggered: {} low reached {} on {}", stop.ticker(), stop.triggerPrice(), date);
            result = result.then(s -> executor.sell(s, date, stop.ticker(), stop.triggerPrice(), ExitReason.STOP_LOSS));
        }
        return result;
    }
}

package com.marginal.engine;

import com.marginal.core.model.Candidate;
import com.marginal.core.model.EntryMode;
import com.marginal.core.model.OrderRejection;
import com.marginal.core.model.Position;
import com.marginal.core.model.PriceBar;
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
 * Turns a day's candidates into buys on the next trading day.
 *
 * In market mode the candidates are carried over and bought at the next day's open.
 * In limit mode a sized limit order is placed at the signal day's open and lives for
 * the next day only. Either way, a candidate for an instrument already held merges
 * into the position only while the position's last signal is within the holding
 * period; older positions are left to the exit rules.
 */
public class EntryPlanner {

    private static final Logger log = LoggerFactory.getLogger(EntryPlanner.class);

    private final EntryMode mode;
    private final StrategyRules rules;
    private final PriceRepository prices;
    private final OrderExecutor executor;
    private final TradingDays days;

    public EntryPlanner(EntryMode mode, StrategyRules rules, PriceRepository prices,
                        OrderExecutor executor, TradingDays days) {
        this.mode = mode;
        this.rules = rules;
        this.prices = prices;
        this.executor = executor;
        this.days = days;
    }

    /**
     * Schedule entries for the candidates found on {@code signalDate}.
     * Nothing is scheduled on the last date of the run.
     */
    public StepResult schedule(EngineState state, List<Candidate> candidates, LocalDate signalDate) {
        Optional<LocalDate> nextDate = days.next(signalDate);
        if (nextDate.isEmpty() || candidates.isEmpty()) {
            return StepResult.of(state.withScheduledEntries(List.of()));
        }
        if (mode == EntryMode.MARKET_AT_OPEN) {
            return StepResult.of(state.withScheduledEntries(candidates));
        }

        StepResult result = StepResult.of(state.withScheduledEntries(List.of()));
        for (Candidate candidate : candidates) {
            result = result.then(s -> placeLimit(s, candidate, nextDate.get()));
        }
        return result;
    }

    /**
     * Execute everything scheduled for {@code date}: market buys at the open, then limit fills.
     */
    public StepResult execute(EngineState state, LocalDate date) {
        StepResult result = StepResult.of(state.withScheduledEntries(List.of()));
        for (Candidate candidate : state.scheduledEntries()) {
            result = result.then(s -> buyAtOpen(s, candidate, date));
        }
        if (!state.pendingEntries().isEmpty()) {
            result = result.then(s -> fillLimits(s, date));
        }
        return result;
    }

    /**
     * True when a new signal may add to the existing position, or nothing is held.
     */
    boolean acceptsSignal(EngineState state, String ticker, LocalDate signalDate) {
        Optional<Position> held = state.ledger().get(ticker);
        if (held.isEmpty()) {
            return true;
        }
        int elapsed = days.elapsed(held.get().entrySignalDate(), signalDate);
        if (elapsed < rules.holdingPeriod()) {
            return true;
        }
        log.debug("Signal for {} on {} ignored, held since signal {} ({} days)",
            ticker, signalDate, held.get().entrySignalDate(), elapsed);
        return false;
    }

    private StepResult buyAtOpen(EngineState state, Candidate candidate, LocalDate date) {
        if (!acceptsSignal(state, candidate.ticker(), candidate.signalDate())) {
            return StepResult.of(state);
        }
        OptionalDouble open = prices.findOpen(candidate.ticker(), date);
        if (open.isEmpty()) {
            log.debug("No open for {} on {}, entry skipped", candidate.ticker(), date);
            return StepResult.rejected(state,
                new OrderRejection(candidate.ticker(), date, OrderRejection.Reason.NO_PRICE));
        }
        return executor.buy(state, date, candidate.ticker(), candidate.name(),
            open.getAsDouble(), candidate.signalDate());
    }

    private StepResult placeLimit(EngineState state, Candidate candidate, LocalDate executionDate) {
        LocalDate signalDate = candidate.signalDate();
        if (!acceptsSignal(state, candidate.ticker(), signalDate)) {
            return StepResult.of(state);
        }
        double limit = candidate.signal().open();
        OrderSizing sizing = executor.size(state.cash(), limit);
        if (sizing.shares() <= 0) {
            return StepResult.rejected(state,
                new OrderRejection(candidate.ticker(), signalDate, OrderRejection.Reason.NO_SHARES));
        }
        if (sizing.totalCost() > state.cash()) {
            return StepResult.rejected(state,
                new OrderRejection(candidate.ticker(), signalDate, OrderRejection.Reason.INSUFFICIENT_CASH));
        }
        log.debug("Limit placed: {} {} @ {} for {}", sizing.shares(), candidate.ticker(), limit, executionDate);
        return StepResult.of(state.withPendingEntry(new PendingEntry(candidate.ticker(), candidate.name(),
            limit, sizing.shares(), sizing.oddLot(), signalDate, executionDate)));
    }

    private StepResult fillLimits(EngineState state, LocalDate date) {
        List<PendingEntry> due = new ArrayList<>();
        List<PendingEntry> remaining = new ArrayList<>();
        for (PendingEntry entry : state.pendingEntries()) {
            if (entry.executionDate().equals(date) || entry.isExpired(date)) {
                due.add(entry);
            } else {
                remaining.add(entry);
            }
        }

        StepResult result = StepResult.of(state.withPendingEntries(remaining));
        for (PendingEntry entry : due) {
            result = result.then(s -> fillLimit(s, entry, date));
        }
        return result;
    }

    private StepResult fillLimit(EngineState state, PendingEntry entry, LocalDate date) {
        Optional<PriceBar> bar = entry.isExpired(date) ? Optional.empty() : prices.findBar(entry.ticker(), date);
        if (bar.isEmpty() || !entry.isFilledBy(bar.get())) {
            log.debug("Limit expired: {} @ {} on {}", entry.ticker(), entry.limitPrice(), date);
            return StepResult.rejected(state,
                new OrderRejection(entry.ticker(), date, OrderRejection.Reason.ORDER_EXPIRED));
        }
        return executor.buyShares(state, date, entry.ticker(), entry.name(), entry.limitPrice(),
            entry.shares(), entry.oddLot(), entry.signalDate());
    }
}

package com.marginal.engine;

import com.marginal.core.model.OpenHolding;
import com.marginal.core.model.PortfolioSnapshot;
import com.marginal.core.model.Position;
import com.marginal.core.source.PriceRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Marks the portfolio to market at the day's close.
 */
public class PortfolioValuator {

    private final PriceRepository prices;

    public PortfolioValuator(PriceRepository prices) {
        this.prices = prices;
    }

    /**
     * Cash plus each position at the day's close. A held instrument with no close
     * for the date contributes nothing to that day's value.
     */
    public PortfolioSnapshot snapshot(EngineState state, LocalDate date) {
        double value = state.cash();
        for (Position position : state.ledger().positions()) {
            OptionalDouble close = prices.findClose(position.ticker(), date);
            if (close.isPresent()) {
                value += position.marketValue(close.getAsDouble());
            }
        }
        return new PortfolioSnapshot(date, state.cash(), value, state.ledger().size());
    }

    /**
     * Positions still open at the end of the run, each valued at its most recent
     * close on or before {@code lastDate}.
     */
    public List<OpenHolding> openHoldings(PositionLedger ledger, TradingDays days, LocalDate lastDate) {
        List<LocalDate> lookback = days.backwardsFrom(lastDate);
        List<OpenHolding> holdings = new ArrayList<>();
        for (Position position : ledger.positions()) {
            OpenHolding holding = OpenHolding.of(position, null, null);
            for (LocalDate date : lookback) {
                OptionalDouble close = prices.findClose(position.ticker(), date);
                if (close.isPresent()) {
                    holding = OpenHolding.of(position, close.getAsDouble(), date);
                    break;
                }
            }
            holdings.add(holding);
        }
        return holdings;
    }
}

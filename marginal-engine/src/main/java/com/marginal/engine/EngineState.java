package com.marginal.engine;

import com.marginal.core.model.Candidate;
import com.marginal.core.model.Position;
import com.marginal.core.model.StopLossOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete simulation state between two steps of a trading day.
 *
 * @param cash            uninvested cash, never negative
 * @param ledger          open positions
 * @param stopOrders      standing stop-loss orders keyed by ticker
 * @param scheduledEntries candidates from the previous day awaiting a market fill at today's open
 * @param pendingEntries  limit orders awaiting today's low
 */
public record EngineState(
    double cash,
    PositionLedger ledger,
    Map<String, StopLossOrder> stopOrders,
    List<Candidate> scheduledEntries,
    List<PendingEntry> pendingEntries
) {
    public EngineState {
        stopOrders = Collections.unmodifiableMap(new LinkedHashMap<>(stopOrders));
        scheduledEntries = List.copyOf(scheduledEntries);
        pendingEntries = List.copyOf(pendingEntries);
    }

    public static EngineState initial(double cash) {
        return new EngineState(cash, PositionLedger.empty(), Map.of(), List.of(), List.of());
    }

    public EngineState withCash(double newCash) {
        return new EngineState(newCash, ledger, stopOrders, scheduledEntries, pendingEntries);
    }

    /**
     * Replace the position for its ticker, debiting or crediting cash in the same step.
     */
    public EngineState withPosition(Position position, double newCash) {
        return new EngineState(newCash, ledger.put(position), stopOrders, scheduledEntries, pendingEntries);
    }

    /**
     * Remove a position and its stop order.
     */
    public EngineState withoutPosition(String ticker, double newCash) {
        Map<String, StopLossOrder> stops = new LinkedHashMap<>(stopOrders);
        stops.remove(ticker);
        return new EngineState(newCash, ledger.remove(ticker), stops, scheduledEntries, pendingEntries);
    }

    public EngineState withStop(StopLossOrder stop) {
        Map<String, StopLossOrder> stops = new LinkedHashMap<>(stopOrders);
        stops.put(stop.ticker(), stop);
        return new EngineState(cash, ledger, stops, scheduledEntries, pendingEntries);
    }

    public EngineState withoutStop(String ticker) {
        Map<String, StopLossOrder> stops = new LinkedHashMap<>(stopOrders);
        stops.remove(ticker);
        return new EngineState(cash, ledger, stops, scheduledEntries, pendingEntries);
    }

    public EngineState withScheduledEntries(List<Candidate> candidates) {
        return new EngineState(cash, ledger, stopOrders, candidates, pendingEntries);
    }

    public EngineState withPendingEntry(PendingEntry entry) {
        List<PendingEntry> entries = new ArrayList<>(pendingEntries);
        entries.add(entry);
        return new EngineState(cash, ledger, stopOrders, scheduledEntries, entries);
    }

    public EngineState withPendingEntries(List<PendingEntry> entries) {
        return new EngineState(cash, ledger, stopOrders, scheduledEntries, entries);
    }
}

package com.marginal.engine;

import com.marginal.core.model.Position;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Open positions keyed by ticker, at most one per ticker.
 * Immutable: every change returns a new ledger. Iteration follows opening order.
 */
public final class PositionLedger {

    private static final PositionLedger EMPTY = new PositionLedger(Collections.emptyMap());

    private final Map<String, Position> positions;

    private PositionLedger(Map<String, Position> positions) {
        this.positions = positions;
    }

    public static PositionLedger empty() {
        return EMPTY;
    }

    public Optional<Position> get(String ticker) {
        return Optional.ofNullable(positions.get(ticker));
    }

    public boolean contains(String ticker) {
        return positions.containsKey(ticker);
    }

    public Collection<Position> positions() {
        return positions.values();
    }

    public int size() {
        return positions.size();
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    /**
     * Insert or replace the position for its ticker.
     */
    public PositionLedger put(Position position) {
        Map<String, Position> copy = new LinkedHashMap<>(positions);
        copy.put(position.ticker(), position);
        return new PositionLedger(Collections.unmodifiableMap(copy));
    }

    public PositionLedger remove(String ticker) {
        if (!positions.containsKey(ticker)) {
            return this;
        }
        Map<String, Position> copy = new LinkedHashMap<>(positions);
        copy.remove(ticker);
        return new PositionLedger(Collections.unmodifiableMap(copy));
    }

    @Override
    public String toString() {
        return "PositionLedger" + positions.keySet();
    }
}

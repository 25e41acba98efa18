package com.marginal.core.model;

import java.time.LocalDate;

/**
 * A signal row that survived the drop filter, with its ranking key.
 * Lives only for the day it was scanned.
 */
public record Candidate(SignalRow signal, double dropPct) {

    public static Candidate of(SignalRow signal) {
        return new Candidate(signal, signal.dropPct());
    }

    public String ticker() {
        return signal.ticker();
    }

    public String name() {
        return signal.name();
    }

    public LocalDate signalDate() {
        return signal.date();
    }
}

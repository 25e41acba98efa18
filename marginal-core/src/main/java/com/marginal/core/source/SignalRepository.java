package com.marginal.core.source;

import com.marginal.core.model.SignalRow;

import java.time.LocalDate;
import java.util.List;

/**
 * Read-only access to the daily signal table.
 */
public interface SignalRepository {

    /**
     * All complete signal rows for a date with a positive margin balance.
     * Empty when the date has no usable rows.
     */
    List<SignalRow> signalsOn(LocalDate date);
}

package com.marginal.core.source;

import java.time.LocalDate;
import java.util.List;

/**
 * Source of truth for which dates are trading days.
 */
public interface TradingCalendar {

    /**
     * Trading dates between start and end, both inclusive, ascending.
     */
    List<LocalDate> tradingDates(LocalDate start, LocalDate end);
}

package com.marginal.core.source;

import com.marginal.core.model.PriceBar;

import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only access to daily prices. Missing, null and zero prices are reported as absent.
 */
public interface PriceRepository {

    /**
     * Full OHLC bar, used for intraday low checks.
     */
    Optional<PriceBar> findBar(String ticker, LocalDate date);

    /**
     * Closing price used for exits and valuation.
     */
    OptionalDouble findClose(String ticker, LocalDate date);

    /**
     * Opening price used for next-day entries.
     */
    OptionalDouble findOpen(String ticker, LocalDate date);
}

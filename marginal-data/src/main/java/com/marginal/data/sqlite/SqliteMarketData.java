package com.marginal.data.sqlite;

import com.marginal.core.model.PriceBar;
import com.marginal.core.model.SignalRow;
import com.marginal.core.source.MarketDataException;
import com.marginal.core.source.PriceRepository;
import com.marginal.core.source.SignalRepository;
import com.marginal.core.source.TradingCalendar;
import com.marginal.data.sqlite.dao.PriceDataDao;
import com.marginal.data.sqlite.dao.StrategyResultDao;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Facade over the market database: trading calendar, daily signals and prices.
 * SQL failures surface as {@link MarketDataException}.
 */
public class SqliteMarketData implements TradingCalendar, SignalRepository, PriceRepository, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteMarketData.class);

    private final SqliteConnection conn;
    private final StrategyResultDao strategyResults;
    private final PriceDataDao priceData;

    public SqliteMarketData(SqliteConnection conn) {
        this.conn = conn;
        this.strategyResults = new StrategyResultDao(conn);
        this.priceData = new PriceDataDao(conn);
    }

    /**
     * Open an existing database file.
     *
     * @throws IllegalArgumentException if the file does not exist
     */
    public static SqliteMarketData open(Path dbFile) {
        SqliteConnection conn = SqliteConnection.forFile(dbFile);
        if (!conn.exists()) {
            throw new IllegalArgumentException("Database not found: " + dbFile.toAbsolutePath());
        }
        log.info("Using market database {}", conn.getDbFile());
        return new SqliteMarketData(conn);
    }

    @Override
    public List<LocalDate> tradingDates(LocalDate start, LocalDate end) {
        try {
            return strategyResults.tradingDates(start, end);
        } catch (SQLException e) {
            throw new MarketDataException("trading dates " + start + " to " + end, e);
        }
    }

    @Override
    public List<SignalRow> signalsOn(LocalDate date) {
        try {
            return strategyResults.signalsOn(date);
        } catch (SQLException e) {
            throw new MarketDataException("signals on " + date, e);
        }
    }

    @Override
    public Optional<PriceBar> findBar(String ticker, LocalDate date) {
        try {
            return priceData.findBar(ticker, date);
        } catch (SQLException e) {
            throw new MarketDataException("bar for " + ticker + " on " + date, e);
        }
    }

    @Override
    public OptionalDouble findClose(String ticker, LocalDate date) {
        try {
            return strategyResults.closePrice(ticker, date);
        } catch (SQLException e) {
            throw new MarketDataException("close for " + ticker + " on " + date, e);
        }
    }

    @Override
    public OptionalDouble findOpen(String ticker, LocalDate date) {
        try {
            return strategyResults.openPrice(ticker, date);
        } catch (SQLException e) {
            throw new MarketDataException("open for " + ticker + " on " + date, e);
        }
    }

    @Override
    public void close() {
        conn.close();
    }
}

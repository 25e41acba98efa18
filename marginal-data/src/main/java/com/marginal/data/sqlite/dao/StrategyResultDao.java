package com.marginal.data.sqlite.dao;

import com.marginal.core.model.SignalRow;
import com.marginal.data.sqlite.DateKeys;
import com.marginal.data.sqlite.SqliteConnection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * DAO for the daily strategy_result table written by the margin analytics pipeline.
 * Also the source of the trading calendar and of the open/close used for fills.
 */
public class StrategyResultDao {

    private final SqliteConnection conn;

    public StrategyResultDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * Distinct dates with any strategy row, inclusive range, ascending.
     */
    public List<LocalDate> tradingDates(LocalDate start, LocalDate end) throws SQLException {
        Connection c = conn.getConnection();
        List<LocalDate> dates = new ArrayList<>();

        String sql = """
            SELECT DISTINCT date
            FROM strategy_result
            WHERE date BETWEEN ? AND ?
            ORDER BY date
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, DateKeys.format(start));
            stmt.setString(2, DateKeys.format(end));

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    dates.add(DateKeys.parse(rs.getString(1)));
                }
            }
        }

        return dates;
    }

    /**
     * Complete rows for a date with a positive margin balance.
     */
    public List<SignalRow> signalsOn(LocalDate date) throws SQLException {
        Connection c = conn.getConnection();
        List<SignalRow> rows = new ArrayList<>();

        String sql = """
            SELECT ticker, stock_name, margin_ratio, avg_10day_ratio,
                   volume, avg_10day_volume, open_price, close_price,
                   margin_balance_shares, avg_5day_balance_95
            FROM strategy_result
            WHERE date = ?
              AND margin_ratio IS NOT NULL
              AND avg_10day_ratio IS NOT NULL
              AND volume IS NOT NULL
              AND avg_10day_volume IS NOT NULL
              AND open_price IS NOT NULL
              AND close_price IS NOT NULL
              AND margin_balance_shares > 0
              AND avg_5day_balance_95 IS NOT NULL
            ORDER BY ticker
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, DateKeys.format(date));

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(readSignal(rs, date));
                }
            }
        }

        return rows;
    }

    public OptionalDouble openPrice(String ticker, LocalDate date) throws SQLException {
        return price("open_price", ticker, date);
    }

    public OptionalDouble closePrice(String ticker, LocalDate date) throws SQLException {
        return price("close_price", ticker, date);
    }

    // Null and zero prices are missing data
    private OptionalDouble price(String column, String ticker, LocalDate date) throws SQLException {
        Connection c = conn.getConnection();

        String sql = "SELECT " + column + " FROM strategy_result WHERE ticker = ? AND date = ? LIMIT 1";

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, ticker);
            stmt.setString(2, DateKeys.format(date));

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    double value = rs.getDouble(1);
                    if (!rs.wasNull() && value != 0) {
                        return OptionalDouble.of(value);
                    }
                }
            }
        }

        return OptionalDouble.empty();
    }

    /**
     * Read a SignalRow from a ResultSet (helper method).
     */
    private SignalRow readSignal(ResultSet rs, LocalDate date) throws SQLException {
        return new SignalRow(
            rs.getString("ticker"),
            rs.getString("stock_name"),
            date,
            rs.getDouble("margin_ratio"),
            rs.getDouble("avg_10day_ratio"),
            rs.getDouble("volume"),
            rs.getDouble("avg_10day_volume"),
            rs.getDouble("open_price"),
            rs.getDouble("close_price"),
            rs.getDouble("margin_balance_shares"),
            rs.getDouble("avg_5day_balance_95")
        );
    }
}

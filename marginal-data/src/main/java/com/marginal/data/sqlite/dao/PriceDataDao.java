package com.marginal.data.sqlite.dao;

import com.marginal.core.model.PriceBar;
import com.marginal.data.sqlite.DateKeys;
import com.marginal.data.sqlite.SqliteConnection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Optional;

/**
 * DAO for daily OHLC bars in tw_stock_price_data.
 */
public class PriceDataDao {

    private final SqliteConnection conn;

    public PriceDataDao(SqliteConnection conn) {
        this.conn = conn;
    }

    /**
     * The bar for a ticker and date. A bar with a null or zero low is treated as missing,
     * since it cannot be used for intraday checks.
     */
    public Optional<PriceBar> findBar(String ticker, LocalDate date) throws SQLException {
        Connection c = conn.getConnection();

        String sql = """
            SELECT open, high, low, close
            FROM tw_stock_price_data
            WHERE ticker = ? AND date = ?
            LIMIT 1
            """;

        try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setString(1, ticker);
            stmt.setString(2, DateKeys.format(date));

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    double low = rs.getDouble("low");
                    if (!rs.wasNull() && low != 0) {
                        return Optional.of(new PriceBar(ticker, date,
                            rs.getDouble("open"), rs.getDouble("high"), low, rs.getDouble("close")));
                    }
                }
            }
        }

        return Optional.empty();
    }
}

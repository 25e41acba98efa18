package com.marginal.data.sqlite;

import com.marginal.core.model.PriceBar;
import com.marginal.core.model.SignalRow;
import com.marginal.core.source.MarketDataException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SQLite market data adapters against a real database file.
 */
class SqliteMarketDataTest {

    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);
    private static final LocalDate JAN_3 = LocalDate.of(2024, 1, 3);

    @TempDir
    Path tempDir;

    private MarketDatabaseFixture fixture;
    private SqliteMarketData data;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new MarketDatabaseFixture(tempDir.resolve("market.db"));
        data = new SqliteMarketData(fixture.connection());
    }

    @AfterEach
    void tearDown() {
        data.close();
    }

    @Nested
    @DisplayName("Trading calendar")
    class Calendar {

        @Test
        @DisplayName("Distinct strategy dates within the inclusive range, ascending")
        void distinctDates() throws Exception {
            fixture.completeRow("20240103", "2330", 500, 510)
                .completeRow("20240102", "2330", 495, 500)
                .completeRow("20240102", "2317", 100, 101)
                .completeRow("20240105", "2330", 510, 520)
                .completeRow("20231229", "2330", 490, 495);

            List<LocalDate> dates = data.tradingDates(JAN_2, LocalDate.of(2024, 1, 5));

            assertEquals(List.of(JAN_2, JAN_3, LocalDate.of(2024, 1, 5)), dates);
        }

        @Test
        @DisplayName("Empty range yields no dates")
        void emptyRange() {
            assertTrue(data.tradingDates(JAN_2, JAN_3).isEmpty());
        }
    }

    @Nested
    @DisplayName("Signals")
    class Signals {

        @Test
        @DisplayName("Reads complete rows with all fields mapped")
        void readsRow() throws Exception {
            fixture.strategyRow("20240102", "2330", "TSMC", 160.5, 170.25, 25000L, 20000.0,
                590.0, 600.0, 12000L, 11000.0);

            List<SignalRow> rows = data.signalsOn(JAN_2);

            assertEquals(1, rows.size());
            SignalRow row = rows.get(0);
            assertEquals("2330", row.ticker());
            assertEquals("TSMC", row.name());
            assertEquals(JAN_2, row.date());
            assertEquals(160.5, row.ratio());
            assertEquals(170.25, row.avg10Ratio());
            assertEquals(25000.0, row.volume());
            assertEquals(20000.0, row.avg10Volume());
            assertEquals(590.0, row.open());
            assertEquals(600.0, row.close());
            assertEquals(12000.0, row.balanceShares());
            assertEquals(11000.0, row.avg5BalanceThreshold());
        }

        @Test
        @DisplayName("Excludes incomplete rows and zero margin balance")
        void excludesIncomplete() throws Exception {
            fixture.completeRow("20240102", "GOOD", 10, 11)
                .strategyRow("20240102", "NORATIO", "n", null, 150.0, 2000L, 1000.0, 10.0, 11.0, 5000L, 4000.0)
                .strategyRow("20240102", "NOOPEN", "n", 140.0, 150.0, 2000L, 1000.0, null, 11.0, 5000L, 4000.0)
                .strategyRow("20240102", "NOTHRESH", "n", 140.0, 150.0, 2000L, 1000.0, 10.0, 11.0, 5000L, null)
                .strategyRow("20240102", "ZEROBAL", "n", 140.0, 150.0, 2000L, 1000.0, 10.0, 11.0, 0L, 4000.0)
                .strategyRow("20240102", "NOBAL", "n", 140.0, 150.0, 2000L, 1000.0, 10.0, 11.0, null, 4000.0);

            List<SignalRow> rows = data.signalsOn(JAN_2);

            assertEquals(List.of("GOOD"), rows.stream().map(SignalRow::ticker).toList());
        }

        @Test
        @DisplayName("Missing display name falls back to the ticker")
        void nameFallback() throws Exception {
            fixture.strategyRow("20240102", "1101", null, 140.0, 150.0, 2000L, 1000.0, 10.0, 11.0, 5000L, 4000.0);

            assertEquals("1101", data.signalsOn(JAN_2).get(0).name());
        }
    }

    @Nested
    @DisplayName("Prices")
    class Prices {

        @Test
        @DisplayName("Open and close come from the strategy table")
        void openClose() throws Exception {
            fixture.completeRow("20240102", "2330", 590, 600);

            assertEquals(OptionalDouble.of(590), data.findOpen("2330", JAN_2));
            assertEquals(OptionalDouble.of(600), data.findClose("2330", JAN_2));
            assertTrue(data.findClose("2330", JAN_3).isEmpty());
        }

        @Test
        @DisplayName("Zero and null prices read as absent")
        void zeroPrices() throws Exception {
            fixture.strategyRow("20240102", "ZERO", "z", 140.0, 150.0, 2000L, 1000.0, 0.0, null, 5000L, 4000.0)
                .bar("20240102", "ZERO", 10.0, 11.0, 0.0, 10.5)
                .bar("20240102", "NULLLOW", 10.0, 11.0, null, 10.5);

            assertTrue(data.findOpen("ZERO", JAN_2).isEmpty());
            assertTrue(data.findClose("ZERO", JAN_2).isEmpty());
            assertTrue(data.findBar("ZERO", JAN_2).isEmpty());
            assertTrue(data.findBar("NULLLOW", JAN_2).isEmpty());
        }

        @Test
        @DisplayName("Bars come from the price table")
        void bar() throws Exception {
            fixture.bar("20240102", "2330", 590.0, 605.0, 585.0, 600.0);

            Optional<PriceBar> bar = data.findBar("2330", JAN_2);

            assertTrue(bar.isPresent());
            assertEquals(new PriceBar("2330", JAN_2, 590, 605, 585, 600), bar.get());
            assertTrue(data.findBar("2330", JAN_3).isEmpty());
        }
    }

    @Test
    @DisplayName("SQL errors surface as MarketDataException with the query context")
    void wrapsSqlErrors() throws Exception {
        fixture.connection().executeInTransaction(c -> {
            try (Statement stmt = c.createStatement()) {
                stmt.execute("DROP TABLE tw_stock_price_data");
            }
        });

        MarketDataException e = assertThrows(MarketDataException.class, () -> data.findBar("2330", JAN_2));
        assertTrue(e.getMessage().contains("bar for 2330 on 2024-01-02"), e.getMessage());
    }

    @Test
    @DisplayName("Opening a missing database file is rejected")
    void missingFile() {
        assertThrows(IllegalArgumentException.class, () -> SqliteMarketData.open(tempDir.resolve("absent.db")));
    }
}

package com.marginal.runner;

import com.marginal.core.model.BacktestConfig;
import com.marginal.core.model.EntryMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunnerConfigTest {

    private final Map<String, String> properties = new HashMap<>();
    private final Map<String, String> env = new HashMap<>();

    private RunnerConfig load(String... args) {
        return RunnerConfig.load(args, properties::get, env);
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        void noArgumentsGivesStandardRun() {
            RunnerConfig config = load();

            assertEquals(Paths.get("taiwan_stock.db"), config.getDbPath());
            assertEquals(LocalDate.of(2020, 1, 1), config.getStartDate());
            assertEquals(LocalDate.of(2025, 11, 17), config.getEndDate());
            assertEquals(1_000_000, config.getInitialCapital());
            assertTrue(config.isTakeProfit());
            assertTrue(config.isStopLoss());
            assertEquals(EntryMode.MARKET_AT_OPEN, config.getEntryMode());
            assertEquals(Paths.get("."), config.getOutputDir());
        }

        @Test
        void buildsEngineConfig() {
            BacktestConfig config = load("--start-date", "20240102", "--end-date", "20240630",
                "--capital", "500000", "--no-stop-loss", "--entry-mode", "limit").toBacktestConfig();

            assertEquals(LocalDate.of(2024, 1, 2), config.startDate());
            assertEquals(LocalDate.of(2024, 6, 30), config.endDate());
            assertEquals(500_000, config.initialCapital());
            assertTrue(config.enableTakeProfit());
            assertFalse(config.enableStopLoss());
            assertEquals(EntryMode.LIMIT_AT_SIGNAL_OPEN, config.entryMode());
        }
    }

    @Nested
    @DisplayName("Precedence")
    class Precedence {

        @Test
        void flagOverridesPropertyAndEnvironment() {
            properties.put("marginal.db", "from-property.db");
            env.put("MARGINAL_DB", "from-env.db");

            assertEquals(Paths.get("from-flag.db"), load("--db", "from-flag.db").getDbPath());
        }

        @Test
        void propertyOverridesEnvironment() {
            properties.put("marginal.start_date", "20230101");
            env.put("MARGINAL_START_DATE", "20220101");

            assertEquals(LocalDate.of(2023, 1, 1), load().getStartDate());
        }

        @Test
        void environmentOverridesDefault() {
            env.put("MARGINAL_CAPITAL", "250000");
            env.put("MARGINAL_OUTPUT_DIR", "/tmp/out");

            RunnerConfig config = load();
            assertEquals(250_000, config.getInitialCapital());
            assertEquals(Paths.get("/tmp/out"), config.getOutputDir());
        }
    }

    @Nested
    @DisplayName("Invalid input")
    class InvalidInput {

        @Test
        void zeroCapitalRejected() {
            assertThrows(IllegalArgumentException.class, () -> load("--capital", "0"));
        }

        @Test
        void unknownFlagRejected() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> load("--fast"));
            assertTrue(e.getMessage().contains("--fast"));
        }

        @Test
        void missingValueRejected() {
            assertThrows(IllegalArgumentException.class, () -> load("--db"));
            assertThrows(IllegalArgumentException.class, () -> load("--db", "--no-stop-loss"));
        }

        @Test
        void malformedDateRejected() {
            assertThrows(IllegalArgumentException.class, () -> load("--start-date", "2024-01-02"));
        }

        @Test
        void unknownEntryModeRejected() {
            assertThrows(IllegalArgumentException.class, () -> load("--entry-mode", "stop"));
        }

        @Test
        void invertedWindowRejectedWhenBuildingEngineConfig() {
            RunnerConfig config = load("--start-date", "20240301", "--end-date", "20240101");
            assertThrows(IllegalArgumentException.class, config::toBacktestConfig);
        }
    }

    @Nested
    @DisplayName("Help")
    class Help {

        @Test
        void detectedAnywhereInArguments() {
            assertTrue(RunnerConfig.isHelpRequested(new String[]{"--help"}));
            assertTrue(RunnerConfig.isHelpRequested(new String[]{"--capital", "5", "-h"}));
            assertFalse(RunnerConfig.isHelpRequested(new String[]{"--db", "x.db"}));
            assertTrue(RunnerConfig.usage().contains("--entry-mode"));
        }

        @Test
        void acceptedAsAFlagWhenLoading() {
            assertDoesNotThrow(() -> load("--help"));
        }
    }
}

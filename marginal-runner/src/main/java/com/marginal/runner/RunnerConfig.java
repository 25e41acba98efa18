package com.marginal.runner;

import com.marginal.core.model.BacktestConfig;
import com.marginal.core.model.EntryMode;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Configuration for a command-line backtest run.
 *
 * Each setting is resolved from its command-line flag, then the matching
 * {@code marginal.*} system property, then the {@code MARGINAL_*} environment
 * variable, then the default.
 */
public class RunnerConfig {
    static final DateTimeFormatter DATE_KEY = DateTimeFormatter.BASIC_ISO_DATE;

    private static final String DEFAULT_DB = "taiwan_stock.db";
    private static final String DEFAULT_START = "20200101";
    private static final String DEFAULT_END = "20251117";
    private static final String DEFAULT_CAPITAL = "1000000";

    private final Path dbPath;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final double initialCapital;
    private final boolean takeProfit;
    private final boolean stopLoss;
    private final EntryMode entryMode;
    private final Path outputDir;

    public RunnerConfig(Path dbPath, LocalDate startDate, LocalDate endDate, double initialCapital,
                        boolean takeProfit, boolean stopLoss, EntryMode entryMode, Path outputDir) {
        this.dbPath = dbPath;
        this.startDate = startDate;
        this.endDate = endDate;
        this.initialCapital = initialCapital;
        this.takeProfit = takeProfit;
        this.stopLoss = stopLoss;
        this.entryMode = entryMode;
        this.outputDir = outputDir;
    }

    public static RunnerConfig load(String[] args) {
        return load(args, System::getProperty, System.getenv());
    }

    /**
     * Resolve against explicit property and environment sources.
     *
     * @throws IllegalArgumentException on an unknown flag, a missing flag value or a malformed value
     */
    static RunnerConfig load(String[] args, UnaryOperator<String> properties, Map<String, String> env) {
        String db = null;
        String start = null;
        String end = null;
        String capital = null;
        String mode = null;
        String output = null;
        boolean takeProfit = true;
        boolean stopLoss = true;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--db" -> db = valueOf(args, ++i, arg);
                case "--start-date" -> start = valueOf(args, ++i, arg);
                case "--end-date" -> end = valueOf(args, ++i, arg);
                case "--capital" -> capital = valueOf(args, ++i, arg);
                case "--entry-mode" -> mode = valueOf(args, ++i, arg);
                case "--output-dir" -> output = valueOf(args, ++i, arg);
                case "--no-take-profit" -> takeProfit = false;
                case "--no-stop-loss" -> stopLoss = false;
                case "-h", "--help" -> {
                    // usage is printed before loading, see isHelpRequested
                }
                default -> throw new IllegalArgumentException("Unknown option: " + arg + " (see --help)");
            }
        }

        db = resolve(db, "marginal.db", "MARGINAL_DB", DEFAULT_DB, properties, env);
        start = resolve(start, "marginal.start_date", "MARGINAL_START_DATE", DEFAULT_START, properties, env);
        end = resolve(end, "marginal.end_date", "MARGINAL_END_DATE", DEFAULT_END, properties, env);
        capital = resolve(capital, "marginal.capital", "MARGINAL_CAPITAL", DEFAULT_CAPITAL, properties, env);
        mode = resolve(mode, "marginal.entry_mode", "MARGINAL_ENTRY_MODE", "market", properties, env);
        output = resolve(output, "marginal.output.dir", "MARGINAL_OUTPUT_DIR", ".", properties, env);

        double initialCapital = parseCapital(capital);
        if (!(initialCapital > 0)) {
            throw new IllegalArgumentException("Initial capital must be positive: " + capital);
        }

        return new RunnerConfig(Paths.get(db), parseDate(start, "start date"), parseDate(end, "end date"),
            initialCapital, takeProfit, stopLoss, EntryMode.fromValue(mode), Paths.get(output));
    }

    /**
     * True when the arguments ask for usage, regardless of whether the other settings are valid.
     */
    public static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String valueOf(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + flag + " (see --help)");
        }
        return args[index];
    }

    private static String resolve(String flagValue, String property, String envVar, String fallback,
                                  UnaryOperator<String> properties, Map<String, String> env) {
        if (flagValue != null) {
            return flagValue;
        }
        String fromProperty = properties.apply(property);
        if (fromProperty != null) {
            return fromProperty;
        }
        return env.getOrDefault(envVar, fallback);
    }

    private static LocalDate parseDate(String value, String label) {
        try {
            return LocalDate.parse(value.trim(), DATE_KEY);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + label + " '" + value + "' (expected yyyyMMdd)", e);
        }
    }

    private static double parseCapital(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid capital '" + value + "'", e);
        }
    }

    public static String usage() {
        return """
            Usage: marginal [options]

              --db <file>             Market database (default taiwan_stock.db)
              --start-date <yyyyMMdd> First simulated date (default 20200101)
              --end-date <yyyyMMdd>   Last simulated date (default 20251117)
              --capital <amount>      Initial capital (default 1000000)
              --no-take-profit        Disable the take-profit exit
              --no-stop-loss          Disable the stop-loss exit and stop orders
              --entry-mode <mode>     market (next open) or limit (signal-day open), default market
              --output-dir <dir>      Directory for exported results (default .)
              --help                  Show this message

            Options may also be set with -Dmarginal.<name> or MARGINAL_<NAME>,
            e.g. -Dmarginal.db=... or MARGINAL_START_DATE=20230101.
            """;
    }

    /**
     * Build the engine configuration.
     *
     * @throws IllegalArgumentException if the window is inverted
     */
    public BacktestConfig toBacktestConfig() {
        return new BacktestConfig(startDate, endDate, initialCapital, takeProfit, stopLoss, entryMode);
    }

    public Path getDbPath() {
        return dbPath;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public double getInitialCapital() {
        return initialCapital;
    }

    public boolean isTakeProfit() {
        return takeProfit;
    }

    public boolean isStopLoss() {
        return stopLoss;
    }

    public EntryMode getEntryMode() {
        return entryMode;
    }

    public Path getOutputDir() {
        return outputDir;
    }
}

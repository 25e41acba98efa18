package com.marginal.runner;

import com.marginal.core.model.BacktestResult;
import com.marginal.core.source.MarketDataException;
import com.marginal.data.sqlite.SqliteMarketData;
import com.marginal.engine.BacktestEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Command-line entry point: runs the margin-ratio backtest over a market database
 * and exports the results.
 */
public class MarginalApp {
    private static final Logger LOG = LoggerFactory.getLogger(MarginalApp.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Run with the given arguments and return the process exit status.
     */
    static int run(String[] args) {
        if (RunnerConfig.isHelpRequested(args)) {
            System.out.println(RunnerConfig.usage());
            return 0;
        }

        RunnerConfig config;
        try {
            config = RunnerConfig.load(args);
        } catch (IllegalArgumentException e) {
            LOG.error(e.getMessage());
            System.err.println(RunnerConfig.usage());
            return 1;
        }

        try (SqliteMarketData data = SqliteMarketData.open(config.getDbPath())) {
            BacktestEngine engine = new BacktestEngine(data, data, data);
            BacktestResult result = engine.run(config.toBacktestConfig());

            new ConsoleReport(result).print(LOG);

            List<Path> files = new ResultStore(config.getOutputDir()).save(result, LocalDateTime.now());
            for (Path file : files) {
                LOG.info("Wrote {}", file.toAbsolutePath());
            }
            return 0;
        } catch (MarketDataException e) {
            LOG.error("Market data failure: {}", e.getMessage(), e);
            return 1;
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid run configuration: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("Failed to export results to {}: {}", config.getOutputDir(), e.getMessage(), e);
            return 1;
        }
    }
}

package com.marginal.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marginal.core.model.BacktestResult;
import com.marginal.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Exports a finished run into an output directory:
 * - backtest_trades_{timestamp}.csv (one row per trade, only when there are trades)
 * - backtest_summary_{timestamp}.json (config, metrics, daily snapshots, open holdings)
 */
public class ResultStore {

    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final char BOM = '\uFEFF';

    static final String TRADE_HEADER = "date,action,ticker,name,shares,price,value,commission,tax,"
        + "net_amount,odd_lot,signal_date,entry_price,pnl,pnl_pct,reason,holding_days";

    private final Path outputDir;
    private final ObjectMapper mapper;

    public ResultStore(Path outputDir) {
        this.outputDir = outputDir;

        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * Write the run's artifacts, stamped with the given time.
     *
     * @return the files written, trades first
     */
    public List<Path> save(BacktestResult result, LocalDateTime timestamp) throws IOException {
        Files.createDirectories(outputDir);
        String stamp = timestamp.format(TIMESTAMP);
        List<Path> written = new ArrayList<>();

        if (result.hasTrades()) {
            Path tradesFile = outputDir.resolve("backtest_trades_" + stamp + ".csv");
            writeTrades(tradesFile, result.trades());
            written.add(tradesFile);
        } else {
            log.info("No trades to export");
        }

        Path summaryFile = outputDir.resolve("backtest_summary_" + stamp + ".json");
        writeSummary(summaryFile, result);
        written.add(summaryFile);

        return written;
    }

    /**
     * Write the trade ledger as UTF-8 CSV with a leading byte-order mark.
     */
    void writeTrades(Path file, List<Trade> trades) throws IOException {
        try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8))) {
            writer.print(BOM);
            writer.println(TRADE_HEADER);
            for (Trade trade : trades) {
                writer.println(toCsv(trade));
            }
            if (writer.checkError()) {
                throw new IOException("Failed writing " + file);
            }
        }
        log.debug("Saved {} trades to {}", trades.size(), file);
    }

    private void writeSummary(Path file, BacktestResult result) throws IOException {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("config", result.config());
        summary.put("rules", result.rules());
        summary.put("tradingDays", result.tradingDays());
        summary.put("duration", result.duration());
        summary.put("metrics", result.metrics());
        summary.put("rejections", result.rejections().size());
        summary.put("openHoldings", result.openHoldings());
        summary.put("snapshots", result.snapshots());

        mapper.writeValue(file.toFile(), summary);
        log.debug("Saved summary to {}", file);
    }

    static String toCsv(Trade t) {
        return String.join(",",
            t.date().toString(),
            t.action().name(),
            escape(t.ticker()),
            escape(t.name()),
            String.valueOf(t.shares()),
            number(t.price()),
            number(t.value()),
            number(t.commission()),
            number(t.tax()),
            number(t.netAmount()),
            String.valueOf(t.oddLot()),
            t.signalDate() != null ? t.signalDate().toString() : "",
            t.entryPrice() != null ? number(t.entryPrice()) : "",
            t.pnl() != null ? number(t.pnl()) : "",
            t.pnlPct() != null ? number(t.pnlPct()) : "",
            t.reason() != null ? t.reason().getValue() : "",
            t.holdingDays() != null ? String.valueOf(t.holdingDays()) : "");
    }

    private static String number(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    static String escape(String field) {
        if (field == null) return "";
        if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }
}

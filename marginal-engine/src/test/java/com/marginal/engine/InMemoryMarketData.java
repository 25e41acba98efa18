package com.marginal.engine;

import com.marginal.core.model.PriceBar;
import com.marginal.core.model.SignalRow;
import com.marginal.core.source.PriceRepository;
import com.marginal.core.source.SignalRepository;
import com.marginal.core.source.TradingCalendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Map-backed market data for engine tests.
 */
class InMemoryMarketData implements TradingCalendar, SignalRepository, PriceRepository {

    static final LocalDate BASE = LocalDate.of(2024, 1, 1);

    private final List<LocalDate> dates = new ArrayList<>();
    private final Map<LocalDate, List<SignalRow>> signals = new HashMap<>();
    private final Map<String, PriceBar> bars = new HashMap<>();
    private final Map<String, Double> opens = new HashMap<>();
    private final Map<String, Double> closes = new HashMap<>();

    /**
     * Calendar of {@code count} consecutive dates starting at BASE.
     */
    static InMemoryMarketData withDays(int count) {
        InMemoryMarketData data = new InMemoryMarketData();
        for (int i = 0; i < count; i++) {
            data.dates.add(BASE.plusDays(i));
        }
        return data;
    }

    static LocalDate day(int index) {
        return BASE.plusDays(index);
    }

    /**
     * A signal row on day {@code index} that passes both scanner stages.
     */
    InMemoryMarketData passingSignal(String ticker, int index, double open, double close) {
        return signal(new SignalRow(ticker, ticker + " Corp", day(index),
            140, 150, 2000, 1000, open, close, 5000, 4000));
    }

    InMemoryMarketData signal(SignalRow row) {
        signals.computeIfAbsent(row.date(), d -> new ArrayList<>()).add(row);
        return this;
    }

    /**
     * Same prices in both the signal table and the bar table.
     */
    InMemoryMarketData price(String ticker, int index, double open, double high, double low, double close) {
        LocalDate date = day(index);
        bars.put(key(ticker, date), new PriceBar(ticker, date, open, high, low, close));
        opens.put(key(ticker, date), open);
        closes.put(key(ticker, date), close);
        return this;
    }

    /**
     * Flat prices over a range of days, with lows at {@code low}.
     */
    InMemoryMarketData flat(String ticker, int from, int to, double price, double low) {
        for (int i = from; i <= to; i++) {
            price(ticker, i, price, price, low, price);
        }
        return this;
    }

    InMemoryMarketData withoutClose(String ticker, int index) {
        closes.remove(key(ticker, day(index)));
        return this;
    }

    InMemoryMarketData withoutBar(String ticker, int index) {
        bars.remove(key(ticker, day(index)));
        return this;
    }

    @Override
    public List<LocalDate> tradingDates(LocalDate start, LocalDate end) {
        return dates.stream().filter(d -> !d.isBefore(start) && !d.isAfter(end)).toList();
    }

    @Override
    public List<SignalRow> signalsOn(LocalDate date) {
        return signals.getOrDefault(date, List.of());
    }

    @Override
    public Optional<PriceBar> findBar(String ticker, LocalDate date) {
        return Optional.ofNullable(bars.get(key(ticker, date)));
    }

    @Override
    public OptionalDouble findClose(String ticker, LocalDate date) {
        Double close = closes.get(key(ticker, date));
        return close != null ? OptionalDouble.of(close) : OptionalDouble.empty();
    }

    @Override
    public OptionalDouble findOpen(String ticker, LocalDate date) {
        Double open = opens.get(key(ticker, date));
        return open != null ? OptionalDouble.of(open) : OptionalDouble.empty();
    }

    private static String key(String ticker, LocalDate date) {
        return ticker + "|" + date;
    }
}

package com.marginal.runner;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleReportTest {

    @Test
    void reportsStatisticsAndHoldings() {
        List<String> lines = new ConsoleReport(RunFixtures.withTrades()).lines();

        assertTrue(lines.stream().anyMatch(l -> l.contains("2024-01-02 to 2024-01-31 (2 trading days)")));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("Final value:") && l.contains("1,021,333")));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("Buys / sells:") && l.endsWith("2 / 1")));
        assertTrue(lines.stream().anyMatch(l -> l.contains("take_profit")));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("Open holdings (1)")));
        assertTrue(lines.stream().anyMatch(l -> l.contains("2317") && l.contains("101.00 on 2024-01-10")));
    }

    @Test
    void emptyRunSkipsSellSection() {
        List<String> lines = new ConsoleReport(RunFixtures.empty()).lines();

        assertTrue(lines.stream().anyMatch(l -> l.startsWith("Final value:") && l.contains("1,000,000")));
        assertTrue(lines.stream().noneMatch(l -> l.startsWith("Exit reasons")));
        assertTrue(lines.stream().noneMatch(l -> l.startsWith("Open holdings")));
    }
}

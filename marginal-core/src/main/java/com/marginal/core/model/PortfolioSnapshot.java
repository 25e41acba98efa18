package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * End-of-day mark-to-market state. One per simulated day.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PortfolioSnapshot(
    LocalDate date,
    double cash,
    double portfolioValue,
    int openPositions
) {}

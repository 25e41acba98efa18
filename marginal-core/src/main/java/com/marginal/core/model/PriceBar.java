package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.LocalDate;

/**
 * Daily OHLC bar for one instrument.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PriceBar(
    String ticker,
    LocalDate date,
    double open,
    double high,
    double low,
    double close
) {}

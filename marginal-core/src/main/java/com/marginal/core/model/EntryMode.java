package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an entry signal from day D is turned into a fill on day D+1.
 */
public enum EntryMode {
    /**
     * Unconditional fill at D+1's opening price.
     */
    MARKET_AT_OPEN("market"),

    /**
     * Limit order at D's opening price, filled on D+1 only if that day's low
     * reaches it; otherwise the order expires.
     */
    LIMIT_AT_SIGNAL_OPEN("limit");

    private final String value;

    EntryMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EntryMode fromValue(String value) {
        if (value == null) return MARKET_AT_OPEN;
        for (EntryMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown entry mode: " + value + " (expected market or limit)");
    }
}

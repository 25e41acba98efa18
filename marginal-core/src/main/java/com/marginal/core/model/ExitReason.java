package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a position was closed.
 */
public enum ExitReason {
    /**
     * Close reached the take-profit threshold.
     */
    TAKE_PROFIT("take_profit"),

    /**
     * Standing stop order hit on the intraday low, or close breached the stop threshold.
     */
    STOP_LOSS("stop_loss"),

    /**
     * Position held for the full holding period.
     */
    HOLDING_PERIOD("holding_period");

    private final String value;

    ExitReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ExitReason fromValue(String value) {
        for (ExitReason reason : values()) {
            if (reason.value.equalsIgnoreCase(value)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown exit reason: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.marginal.core.model;

import java.time.LocalDate;

/**
 * An entry that was considered but not filled. Never produces a Trade.
 */
public record OrderRejection(String ticker, LocalDate date, Reason reason) {

    public enum Reason {
        /** Sizing rounded down to zero shares. */
        NO_SHARES,
        /** Cost including commission exceeds cash. */
        INSUFFICIENT_CASH,
        /** No fill price for the execution day. */
        NO_PRICE,
        /** Limit price was not reached. */
        ORDER_EXPIRED
    }
}

package com.marginal.core.model;

/**
 * Side of a ledger entry.
 */
public enum TradeAction {
    BUY,
    SELL
}

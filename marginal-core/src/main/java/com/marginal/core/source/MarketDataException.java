package com.marginal.core.source;

/**
 * Thrown when a market data source cannot be read.
 * Carries the query that failed so the message identifies the date and instrument.
 */
public class MarketDataException extends RuntimeException {

    private final String query;

    public MarketDataException(String query, Throwable cause) {
        super(buildMessage(query, cause), cause);
        this.query = query;
    }

    private static String buildMessage(String query, Throwable cause) {
        return String.format("Market data query failed: %s%s",
            query,
            cause != null && cause.getMessage() != null ? " - " + cause.getMessage() : "");
    }

    public String getQuery() {
        return query;
    }
}

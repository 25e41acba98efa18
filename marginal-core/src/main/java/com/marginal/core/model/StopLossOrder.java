package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Standing full-position sell, triggered when a day's low reaches the trigger price.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StopLossOrder(String ticker, double triggerPrice, long shares) {

    /**
     * Stop for the whole position at weightedCost * (1 - stopLossPct).
     */
    public static StopLossOrder forPosition(Position position, double stopLossPct) {
        return new StopLossOrder(position.ticker(),
            position.weightedCost() * (1 - stopLossPct), position.shares());
    }

    public boolean isTriggeredBy(double low) {
        return low <= triggerPrice;
    }
}

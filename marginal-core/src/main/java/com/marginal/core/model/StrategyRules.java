package com.marginal.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Fixed constants of the margin-ratio strategy.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategyRules(
    double positionSizeRatio,  // Fraction of current cash committed per entry
    int holdingPeriod,         // Trading days
    double takeProfit,         // Return fraction, e.g. 0.40 = +40%
    double stopLoss,           // Return fraction, e.g. 0.10 = -10%
    int topN,                  // Scanner stage-1 cut
    int boardLot               // Shares per round lot
) {
    public static final int BOARD_LOT = 1000;

    public StrategyRules {
        if (positionSizeRatio <= 0 || positionSizeRatio > 1) {
            throw new IllegalArgumentException("positionSizeRatio must be in (0, 1]: " + positionSizeRatio);
        }
        if (holdingPeriod <= 0) {
            throw new IllegalArgumentException("holdingPeriod must be positive: " + holdingPeriod);
        }
        if (topN <= 0 || boardLot <= 0) {
            throw new IllegalArgumentException("topN and boardLot must be positive");
        }
    }

    /**
     * The rules the strategy is run with.
     */
    public static StrategyRules standard() {
        return new StrategyRules(0.10, 15, 0.40, 0.10, 10, BOARD_LOT);
    }
}

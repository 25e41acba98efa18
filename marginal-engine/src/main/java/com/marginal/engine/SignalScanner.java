package com.marginal.engine;

import com.marginal.core.model.Candidate;
import com.marginal.core.model.SignalRow;
import com.marginal.core.model.StrategyRules;

import java.util.Comparator;
import java.util.List;

/**
 * Two-stage entry filter over one day's signal rows.
 *
 * Stage 1 keeps rows whose margin ratio fell below its 10-day average and ranks
 * them by relative drop, largest drop first, keeping the top N. Stage 2 requires
 * above-average volume, a bullish bar and a margin balance above the 5-day threshold.
 */
public class SignalScanner {

    private final int topN;

    public SignalScanner(StrategyRules rules) {
        this.topN = rules.topN();
    }

    /**
     * Ranked candidates for the day; empty when nothing passes both stages.
     * Rows with equal drop keep their input order.
     */
    public List<Candidate> scan(List<SignalRow> rows) {
        return rows.stream()
            .filter(r -> r.ratio() < r.avg10Ratio())
            .map(Candidate::of)
            .sorted(Comparator.comparingDouble(Candidate::dropPct))
            .limit(topN)
            .filter(c -> confirms(c.signal()))
            .toList();
    }

    private boolean confirms(SignalRow row) {
        return row.volume() > row.avg10Volume()
            && row.isBullishBar()
            && row.balanceShares() > row.avg5BalanceThreshold();
    }
}

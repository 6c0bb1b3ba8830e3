package com.stockanalyzer.backtester.domain.strategy;

import com.stockanalyzer.backtester.domain.Action;
import com.stockanalyzer.backtester.domain.BarHistory;
import com.stockanalyzer.backtester.domain.PortfolioSnapshot;
import com.stockanalyzer.backtester.domain.Strategy;

/**
 * Base for long-only indicator strategies: a BUY signal opens a position when flat, a SELL
 * signal closes the whole position when holding, anything else holds.
 */
public abstract class SignalStrategy implements Strategy {

    /**
     * Evaluate the indicator rule on the current bar of {@code history}. Returns
     * {@link Signal#none()} when the indicators it needs are not yet available.
     */
    public abstract Signal evaluate(BarHistory history);

    @Override
    public final Action decide(BarHistory history, PortfolioSnapshot portfolio) {
        Signal signal = evaluate(history);
        if (signal.isBuy() && portfolio.isFlat()) {
            return Action.buy(signal.getReason()).withStrength(signal.getStrength());
        }
        if (signal.isSell() && portfolio.hasPosition()) {
            return Action.sellAll(signal.getReason()).withStrength(signal.getStrength());
        }
        return Action.hold();
    }

    @Override
    public String toString() {
        return getName();
    }
}

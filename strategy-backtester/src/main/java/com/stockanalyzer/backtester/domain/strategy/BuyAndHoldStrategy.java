package com.stockanalyzer.backtester.domain.strategy;

import com.stockanalyzer.backtester.domain.BarHistory;

/**
 * Simple buy-and-hold strategy.
 * Buys on the first bar it can and holds until the end.
 */
public class BuyAndHoldStrategy extends SignalStrategy {

    @Override
    public Signal evaluate(BarHistory history) {
        return Signal.buy(1.0, "buy and hold");
    }

    @Override
    public String getName() {
        return "BuyAndHold";
    }
}

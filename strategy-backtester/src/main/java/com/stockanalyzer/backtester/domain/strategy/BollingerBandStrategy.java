package com.stockanalyzer.backtester.domain.strategy;

import com.stockanalyzer.backtester.domain.BarHistory;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Bollinger band reversal: buy on a touch of the lower band, sell on a touch of the upper band.
 */
public class BollingerBandStrategy extends SignalStrategy {

    static final double STRENGTH = 0.7;

    @Override
    public Signal evaluate(BarHistory history) {
        BigDecimal upper = history.currentIndicator(Indicators.BB_UPPER).orElse(null);
        BigDecimal lower = history.currentIndicator(Indicators.BB_LOWER).orElse(null);
        if (upper == null || lower == null) {
            return Signal.none();
        }
        BigDecimal close = history.current().getClose();
        if (close.compareTo(lower) <= 0) {
            return Signal.buy(STRENGTH, "close at lower Bollinger band");
        }
        if (close.compareTo(upper) >= 0) {
            return Signal.sell(STRENGTH, "close at upper Bollinger band");
        }
        return Signal.none();
    }

    @Override
    public Set<String> requiredIndicators() {
        return Set.of(Indicators.BB_UPPER, Indicators.BB_LOWER);
    }

    @Override
    public String getName() {
        return "BollingerBand";
    }
}

package com.stockanalyzer.backtester.domain.strategy;

import com.stockanalyzer.backtester.domain.BarHistory;

import java.math.BigDecimal;
import java.util.Set;

/**
 * MACD signal-line crossover, detected as the histogram changing sign.
 */
public class MacdStrategy extends SignalStrategy {

    static final double STRENGTH = 0.8;

    @Override
    public Signal evaluate(BarHistory history) {
        BigDecimal previous = history.previousIndicator(Indicators.MACD_HISTOGRAM).orElse(null);
        BigDecimal current = history.currentIndicator(Indicators.MACD_HISTOGRAM).orElse(null);
        if (previous == null || current == null) {
            return Signal.none();
        }
        if (previous.signum() <= 0 && current.signum() > 0) {
            return Signal.buy(STRENGTH, "MACD crossed above signal");
        }
        if (previous.signum() >= 0 && current.signum() < 0) {
            return Signal.sell(STRENGTH, "MACD crossed below signal");
        }
        return Signal.none();
    }

    @Override
    public Set<String> requiredIndicators() {
        return Set.of(Indicators.MACD_HISTOGRAM);
    }

    @Override
    public String getName() {
        return "MACD";
    }
}

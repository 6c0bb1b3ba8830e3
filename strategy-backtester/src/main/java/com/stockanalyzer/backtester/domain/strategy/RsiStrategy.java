package com.stockanalyzer.backtester.domain.strategy;

import com.stockanalyzer.backtester.domain.BarHistory;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;

/**
 * RSI mean reversion: buy when oversold, sell when overbought.
 */
public class RsiStrategy extends SignalStrategy {

    public static final double DEFAULT_OVERSOLD = 35;
    public static final double DEFAULT_OVERBOUGHT = 65;

    static final double STRENGTH = 0.8;

    private final BigDecimal oversold;
    private final BigDecimal overbought;

    public RsiStrategy() {
        this(DEFAULT_OVERSOLD, DEFAULT_OVERBOUGHT);
    }

    public RsiStrategy(double oversold, double overbought) {
        if (oversold < 0 || overbought > 100 || oversold >= overbought) {
            throw new IllegalArgumentException(
                    "RSI thresholds must satisfy 0 <= oversold < overbought <= 100, got "
                            + oversold + "/" + overbought);
        }
        this.oversold = BigDecimal.valueOf(oversold);
        this.overbought = BigDecimal.valueOf(overbought);
    }

    @Override
    public Signal evaluate(BarHistory history) {
        Optional<BigDecimal> rsi = history.currentIndicator(Indicators.RSI);
        if (rsi.isEmpty()) {
            return Signal.none();
        }
        if (rsi.get().compareTo(oversold) <= 0) {
            return Signal.buy(STRENGTH, "RSI oversold (" + rsi.get().stripTrailingZeros().toPlainString() + ")");
        }
        if (rsi.get().compareTo(overbought) >= 0) {
            return Signal.sell(STRENGTH, "RSI overbought (" + rsi.get().stripTrailingZeros().toPlainString() + ")");
        }
        return Signal.none();
    }

    @Override
    public Set<String> requiredIndicators() {
        return Set.of(Indicators.RSI);
    }

    @Override
    public String getName() {
        return "RSI(" + oversold.stripTrailingZeros().toPlainString() + ","
                + overbought.stripTrailingZeros().toPlainString() + ")";
    }
}

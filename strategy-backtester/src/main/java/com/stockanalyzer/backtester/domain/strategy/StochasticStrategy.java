package com.stockanalyzer.backtester.domain.strategy;

import com.stockanalyzer.backtester.domain.BarHistory;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Stochastic oscillator: buy when %K and %D are both oversold, sell when both are overbought.
 */
public class StochasticStrategy extends SignalStrategy {

    public static final double DEFAULT_OVERSOLD = 20;
    public static final double DEFAULT_OVERBOUGHT = 80;

    static final double STRENGTH = 0.6;

    private final BigDecimal oversold;
    private final BigDecimal overbought;

    public StochasticStrategy() {
        this(DEFAULT_OVERSOLD, DEFAULT_OVERBOUGHT);
    }

    public StochasticStrategy(double oversold, double overbought) {
        if (oversold < 0 || overbought > 100 || oversold >= overbought) {
            throw new IllegalArgumentException(
                    "Stochastic thresholds must satisfy 0 <= oversold < overbought <= 100, got "
                            + oversold + "/" + overbought);
        }
        this.oversold = BigDecimal.valueOf(oversold);
        this.overbought = BigDecimal.valueOf(overbought);
    }

    @Override
    public Signal evaluate(BarHistory history) {
        BigDecimal k = history.currentIndicator(Indicators.STOCH_K).orElse(null);
        BigDecimal d = history.currentIndicator(Indicators.STOCH_D).orElse(null);
        if (k == null || d == null) {
            return Signal.none();
        }
        if (k.compareTo(oversold) <= 0 && d.compareTo(oversold) <= 0) {
            return Signal.buy(STRENGTH, "stochastic oversold");
        }
        if (k.compareTo(overbought) >= 0 && d.compareTo(overbought) >= 0) {
            return Signal.sell(STRENGTH, "stochastic overbought");
        }
        return Signal.none();
    }

    @Override
    public Set<String> requiredIndicators() {
        return Set.of(Indicators.STOCH_K, Indicators.STOCH_D);
    }

    @Override
    public String getName() {
        return "Stochastic(" + oversold.stripTrailingZeros().toPlainString() + ","
                + overbought.stripTrailingZeros().toPlainString() + ")";
    }
}

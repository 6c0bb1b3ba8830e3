package com.stockanalyzer.backtester.domain.strategy;

import com.stockanalyzer.backtester.domain.Bar;
import com.stockanalyzer.backtester.domain.BarHistory;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;

/**
 * Moving Average Crossover Strategy.
 * Buys when the fast average crosses above the slow average (golden cross), sells when it
 * crosses below (dead cross). The averages are read from the bars' indicators.
 */
public class MovingAverageCrossoverStrategy extends SignalStrategy {

    static final double STRENGTH = 0.9;

    private final String fastIndicator;
    private final String slowIndicator;

    public MovingAverageCrossoverStrategy() {
        this(Indicators.SMA_25, Indicators.SMA_75);
    }

    public MovingAverageCrossoverStrategy(String fastIndicator, String slowIndicator) {
        if (fastIndicator == null || slowIndicator == null) {
            throw new IllegalArgumentException("Fast and slow indicators are required");
        }
        if (fastIndicator.equals(slowIndicator)) {
            throw new IllegalArgumentException("Fast and slow indicators must differ");
        }
        this.fastIndicator = fastIndicator;
        this.slowIndicator = slowIndicator;
    }

    @Override
    public Signal evaluate(BarHistory history) {
        Optional<Bar> previous = history.previous();
        if (previous.isEmpty()) {
            return Signal.none();
        }
        BigDecimal prevFast = previous.get().indicator(fastIndicator).orElse(null);
        BigDecimal prevSlow = previous.get().indicator(slowIndicator).orElse(null);
        BigDecimal fast = history.currentIndicator(fastIndicator).orElse(null);
        BigDecimal slow = history.currentIndicator(slowIndicator).orElse(null);
        if (prevFast == null || prevSlow == null || fast == null || slow == null) {
            return Signal.none();
        }

        if (prevFast.compareTo(prevSlow) <= 0 && fast.compareTo(slow) > 0) {
            return Signal.buy(STRENGTH, "golden cross " + fastIndicator + "/" + slowIndicator);
        }
        if (prevFast.compareTo(prevSlow) >= 0 && fast.compareTo(slow) < 0) {
            return Signal.sell(STRENGTH, "dead cross " + fastIndicator + "/" + slowIndicator);
        }
        return Signal.none();
    }

    @Override
    public Set<String> requiredIndicators() {
        return Set.of(fastIndicator, slowIndicator);
    }

    @Override
    public String getName() {
        return "MovingAverageCrossover(" + fastIndicator + "," + slowIndicator + ")";
    }
}

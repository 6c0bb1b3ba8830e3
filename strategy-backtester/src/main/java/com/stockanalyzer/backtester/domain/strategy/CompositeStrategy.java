package com.stockanalyzer.backtester.domain.strategy;

import com.stockanalyzer.backtester.domain.BarHistory;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Weighted vote over several indicator strategies.
 * <p>
 * Each component that signals adds its weight to the buy or sell score. A side wins when its
 * score reaches its threshold. When both sides reach their thresholds the higher score wins
 * and an exact tie holds.
 */
public class CompositeStrategy extends SignalStrategy {

    public static final double DEFAULT_RSI_WEIGHT = 0.25;
    public static final double DEFAULT_MA_WEIGHT = 0.35;
    public static final double DEFAULT_MACD_WEIGHT = 0.25;
    public static final double DEFAULT_BB_WEIGHT = 0.15;
    public static final double DEFAULT_THRESHOLD = 0.4;

    private final List<Component> components;
    private final double buyThreshold;
    private final double sellThreshold;

    public CompositeStrategy(List<Component> components, double buyThreshold, double sellThreshold) {
        if (components == null || components.isEmpty()) {
            throw new IllegalArgumentException("Composite strategy needs at least one component");
        }
        for (Component component : components) {
            if (component.getStrategy() == null || !(component.getWeight() > 0)) {
                throw new IllegalArgumentException("Component weights must be positive, got " + component);
            }
        }
        if (!(buyThreshold > 0) || !(sellThreshold > 0)) {
            throw new IllegalArgumentException("Vote thresholds must be positive, got "
                    + buyThreshold + "/" + sellThreshold);
        }
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
        this.buyThreshold = buyThreshold;
        this.sellThreshold = sellThreshold;
    }

    /**
     * RSI, moving average crossover, MACD and Bollinger band with the dashboard's default weights.
     */
    public static CompositeStrategy withDefaults() {
        return withWeights(DEFAULT_RSI_WEIGHT, DEFAULT_MA_WEIGHT, DEFAULT_MACD_WEIGHT, DEFAULT_BB_WEIGHT,
                DEFAULT_THRESHOLD, DEFAULT_THRESHOLD);
    }

    public static CompositeStrategy withWeights(double rsiWeight, double maWeight, double macdWeight,
                                                double bbWeight, double buyThreshold, double sellThreshold) {
        return new CompositeStrategy(List.of(
                new Component(new RsiStrategy(), rsiWeight),
                new Component(new MovingAverageCrossoverStrategy(), maWeight),
                new Component(new MacdStrategy(), macdWeight),
                new Component(new BollingerBandStrategy(), bbWeight)),
                buyThreshold, sellThreshold);
    }

    @Override
    public Signal evaluate(BarHistory history) {
        double buyScore = 0.0;
        double sellScore = 0.0;
        StringJoiner buyReasons = new StringJoiner(" | ");
        StringJoiner sellReasons = new StringJoiner(" | ");

        for (Component component : components) {
            Signal signal = component.getStrategy().evaluate(history);
            if (signal.isBuy()) {
                buyScore += component.getWeight();
                buyReasons.add(signal.getReason());
            } else if (signal.isSell()) {
                sellScore += component.getWeight();
                sellReasons.add(signal.getReason());
            }
        }

        boolean buy = buyScore >= buyThreshold;
        boolean sell = sellScore >= sellThreshold;
        if (buy && sell) {
            if (buyScore == sellScore) {
                return Signal.none();
            }
            buy = buyScore > sellScore;
            sell = !buy;
        }
        if (buy) {
            return Signal.buy(buyScore, buyReasons.toString());
        }
        if (sell) {
            return Signal.sell(sellScore, sellReasons.toString());
        }
        return Signal.none();
    }

    @Override
    public Set<String> requiredIndicators() {
        Set<String> indicators = new LinkedHashSet<>();
        components.forEach(c -> indicators.addAll(c.getStrategy().requiredIndicators()));
        return Collections.unmodifiableSet(indicators);
    }

    @Override
    public String getName() {
        StringJoiner joiner = new StringJoiner(",", "Composite(", ")");
        components.forEach(c -> joiner.add(c.getStrategy().getName() + "=" + c.getWeight()));
        return joiner.toString();
    }

    public List<Component> getComponents() {
        return components;
    }

    @Value
    public static class Component {
        SignalStrategy strategy;
        double weight;
    }
}

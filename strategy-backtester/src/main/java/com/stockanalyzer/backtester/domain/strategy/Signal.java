package com.stockanalyzer.backtester.domain.strategy;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Directional opinion of an indicator rule on the current bar, independent of the portfolio.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Signal {

    private static final Signal NONE = new Signal(Direction.NONE, 0.0, "");

    Direction direction;
    double strength;
    String reason;

    public enum Direction {
        BUY, SELL, NONE
    }

    public static Signal none() {
        return NONE;
    }

    public static Signal buy(double strength, String reason) {
        return new Signal(Direction.BUY, strength, reason);
    }

    public static Signal sell(double strength, String reason) {
        return new Signal(Direction.SELL, strength, reason);
    }

    public boolean isBuy() {
        return direction == Direction.BUY;
    }

    public boolean isSell() {
        return direction == Direction.SELL;
    }
}
